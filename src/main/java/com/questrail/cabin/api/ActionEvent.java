package com.questrail.cabin.api;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A single driver interaction reported on the action topic.
 *
 * @param action    wire name of the action; may name an action outside {@link VehicleAction}
 * @param timestamp when the action happened
 * @param value     numeric argument, or {@code null} if the action carried none
 */
public record ActionEvent(String action, Instant timestamp, Double value)
{
    public ActionEvent {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static ActionEvent of(String action, Instant timestamp) {
        return new ActionEvent(action, timestamp, null);
    }

    public static ActionEvent of(VehicleAction action, Instant timestamp, Number value) {
        return new ActionEvent(action.wireName(), timestamp, value == null ? null : value.doubleValue());
    }

    public Optional<VehicleAction> knownAction() {
        return VehicleAction.fromWireName(action);
    }

    public Optional<Double> optionalValue() {
        return Optional.ofNullable(value);
    }

    public boolean is(VehicleAction candidate) {
        return candidate.wireName().equals(action);
    }
}
