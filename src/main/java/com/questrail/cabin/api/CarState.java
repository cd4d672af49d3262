package com.questrail.cabin.api;

/**
 * CarState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of the vehicle's controllable cabin subsystems.
 *
 * <p>Transitions produce a new snapshot; see {@code CarStateReducer}. Relative
 * adjustments (increase/decrease, volume up/down, dim/brighten) are clamped to
 * the bounds below. Direct set actions store the requested value as given.</p>
 */
public record CarState(
        boolean climateOn,
        int temperature,
        boolean infotainmentOn,
        int volume,
        boolean lightsOn,
        int brightness,
        boolean seatsHeated,
        int seatPosition
) {
    public static final int MIN_TEMPERATURE = 16;
    public static final int MAX_TEMPERATURE = 30;
    public static final int MIN_VOLUME = 0;
    public static final int MAX_VOLUME = 100;
    public static final int MIN_BRIGHTNESS = 0;
    public static final int MAX_BRIGHTNESS = 100;

    public static CarState defaults() {
        return new CarState(false, 22, false, 50, false, 80, false, 5);
    }

    public CarState withClimateOn(boolean on) {
        return new CarState(on, temperature, infotainmentOn, volume, lightsOn, brightness, seatsHeated, seatPosition);
    }

    public CarState withTemperature(int t) {
        return new CarState(climateOn, t, infotainmentOn, volume, lightsOn, brightness, seatsHeated, seatPosition);
    }

    public CarState withInfotainmentOn(boolean on) {
        return new CarState(climateOn, temperature, on, volume, lightsOn, brightness, seatsHeated, seatPosition);
    }

    public CarState withVolume(int v) {
        return new CarState(climateOn, temperature, infotainmentOn, v, lightsOn, brightness, seatsHeated, seatPosition);
    }

    public CarState withLightsOn(boolean on) {
        return new CarState(climateOn, temperature, infotainmentOn, volume, on, brightness, seatsHeated, seatPosition);
    }

    public CarState withBrightness(int b) {
        return new CarState(climateOn, temperature, infotainmentOn, volume, lightsOn, b, seatsHeated, seatPosition);
    }

    public CarState withSeatsHeated(boolean heated) {
        return new CarState(climateOn, temperature, infotainmentOn, volume, lightsOn, brightness, heated, seatPosition);
    }

    public CarState withSeatPosition(int position) {
        return new CarState(climateOn, temperature, infotainmentOn, volume, lightsOn, brightness, seatsHeated, position);
    }
}
