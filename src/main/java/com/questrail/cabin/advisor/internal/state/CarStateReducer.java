package com.questrail.cabin.advisor.internal.state;

import com.questrail.cabin.api.ActionEvent;
import com.questrail.cabin.api.CarState;
import com.questrail.cabin.api.VehicleAction;

import java.util.Objects;
import java.util.Optional;

/**
 * CarStateReducer
 * -----------------------------------------------------------------------------
 * Pure transition function from ({@link CarState}, action, value) to the next
 * {@link CarState}.
 *
 * <p>It performs no I/O and holds no state. Clamping is asymmetric: relative
 * adjustments are clamped to the {@link CarState} bounds, direct set actions
 * store the requested value unchanged (truncated to an int). A set action
 * without a value, or an action name the advisor does not know, leaves the
 * state as it was.</p>
 */
public final class CarStateReducer
{
    static final int TEMPERATURE_STEP = 1;
    static final int VOLUME_STEP = 10;
    static final int BRIGHTNESS_STEP = 20;

    public CarState apply(CarState state, ActionEvent event) {
        Objects.requireNonNull(event, "event");
        return apply(state, event.action(), event.value());
    }

    public CarState apply(CarState state, String action, Double value) {
        Objects.requireNonNull(state, "state");

        Optional<VehicleAction> known = VehicleAction.fromWireName(action);
        if (known.isEmpty()) {
            return state;
        }

        return switch (known.get()) {
            case CLIMATE_TURN_ON -> state.withClimateOn(true);
            case CLIMATE_TURN_OFF -> state.withClimateOn(false);
            case CLIMATE_SET_TEMPERATURE -> value == null ? state : state.withTemperature(value.intValue());
            case CLIMATE_INCREASE -> state.withTemperature(
                    clamp(state.temperature() + TEMPERATURE_STEP, CarState.MIN_TEMPERATURE, CarState.MAX_TEMPERATURE));
            case CLIMATE_DECREASE -> state.withTemperature(
                    clamp(state.temperature() - TEMPERATURE_STEP, CarState.MIN_TEMPERATURE, CarState.MAX_TEMPERATURE));

            case INFOTAINMENT_PLAY -> state.withInfotainmentOn(true);
            case INFOTAINMENT_STOP -> state.withInfotainmentOn(false);
            case INFOTAINMENT_SET_VOLUME -> value == null ? state : state.withVolume(value.intValue());
            case INFOTAINMENT_VOLUME_UP -> state.withVolume(
                    clamp(state.volume() + VOLUME_STEP, CarState.MIN_VOLUME, CarState.MAX_VOLUME));
            case INFOTAINMENT_VOLUME_DOWN -> state.withVolume(
                    clamp(state.volume() - VOLUME_STEP, CarState.MIN_VOLUME, CarState.MAX_VOLUME));

            case LIGHTS_TURN_ON -> state.withLightsOn(true);
            case LIGHTS_TURN_OFF -> state.withLightsOn(false);
            case LIGHTS_DIM -> state.withBrightness(
                    clamp(state.brightness() - BRIGHTNESS_STEP, CarState.MIN_BRIGHTNESS, CarState.MAX_BRIGHTNESS));
            case LIGHTS_BRIGHTEN -> state.withBrightness(
                    clamp(state.brightness() + BRIGHTNESS_STEP, CarState.MIN_BRIGHTNESS, CarState.MAX_BRIGHTNESS));

            case SEATS_HEAT_ON -> state.withSeatsHeated(true);
            case SEATS_HEAT_OFF -> state.withSeatsHeated(false);
            case SEATS_ADJUST -> value == null ? state : state.withSeatPosition(value.intValue());
        };
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
