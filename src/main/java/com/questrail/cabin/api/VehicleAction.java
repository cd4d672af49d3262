package com.questrail.cabin.api;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * VehicleAction
 * -----------------------------------------------------------------------------
 * The cabin actions the advisor understands, keyed by their wire name.
 *
 * <p>The set is closed for car-state purposes but the wire format is not:
 * actions with names outside this enum are still recorded in the history
 * (they count towards frequencies and the recent window) and simply leave
 * the car state untouched.</p>
 */
public enum VehicleAction
{
    CLIMATE_TURN_ON("climate_turn_on"),
    CLIMATE_TURN_OFF("climate_turn_off"),
    CLIMATE_SET_TEMPERATURE("climate_set_temperature"),
    CLIMATE_INCREASE("climate_increase"),
    CLIMATE_DECREASE("climate_decrease"),

    INFOTAINMENT_PLAY("infotainment_play"),
    INFOTAINMENT_STOP("infotainment_stop"),
    INFOTAINMENT_SET_VOLUME("infotainment_set_volume"),
    INFOTAINMENT_VOLUME_UP("infotainment_volume_up"),
    INFOTAINMENT_VOLUME_DOWN("infotainment_volume_down"),

    LIGHTS_TURN_ON("lights_turn_on"),
    LIGHTS_TURN_OFF("lights_turn_off"),
    LIGHTS_DIM("lights_dim"),
    LIGHTS_BRIGHTEN("lights_brighten"),

    SEATS_HEAT_ON("seats_heat_on"),
    SEATS_HEAT_OFF("seats_heat_off"),
    SEATS_ADJUST("seats_adjust");

    private static final Map<String, VehicleAction> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(VehicleAction::wireName, Function.identity()));

    private final String wireName;

    VehicleAction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire name. Unknown names resolve to empty.
     */
    public static Optional<VehicleAction> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_NAME.get(name));
    }
}
