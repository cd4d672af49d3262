package com.questrail.cabin.advisor.internal.events;

import com.questrail.cabin.api.ActionEvent;

import java.time.Instant;
import java.util.Objects;

/**
 * A decoded driver action arrived from the bus.
 */
public final class ActionReceived extends AdvisorEvent.Base
{
    private final ActionEvent action;

    public ActionReceived(Instant timestamp, ActionEvent action) {
        super(timestamp);
        this.action = Objects.requireNonNull(action, "action");
    }

    public ActionEvent action() {
        return action;
    }

    @Override
    public String toString() {
        return "ActionReceived{" + action + '}';
    }
}
