package com.questrail.cabin.advisor.internal.recommend;

import com.questrail.cabin.api.CarState;
import com.questrail.cabin.api.DriverPreferences;
import com.questrail.cabin.api.VehicleAction;

import java.time.LocalTime;
import java.util.Optional;

/**
 * RecommendationRule
 * -----------------------------------------------------------------------------
 * Eligibility rules in evaluation order. Declaration order is significant:
 * the generator keeps the first eligible rules it meets.
 *
 * <p>Each rule answers with the action to suggest (and its value, if any) or
 * empty. Rules never look at phrasing.</p>
 */
public enum RecommendationRule
{
    CLIMATE_ON {
        @Override
        Optional<Candidate> evaluate(RecommendationContext ctx) {
            CarState car = ctx.carState();
            return when(!car.climateOn(), ctx, VehicleAction.CLIMATE_TURN_ON, null);
        }
    },

    TEMPERATURE_MATCH {
        @Override
        Optional<Candidate> evaluate(RecommendationContext ctx) {
            CarState car = ctx.carState();
            DriverPreferences prefs = ctx.preferences();
            return when(car.climateOn() && prefs.preferredTemperature() != car.temperature(),
                    ctx, VehicleAction.CLIMATE_SET_TEMPERATURE, prefs.preferredTemperature());
        }
    },

    MUSIC {
        @Override
        Optional<Candidate> evaluate(RecommendationContext ctx) {
            return when(!ctx.carState().infotainmentOn() && ctx.preferences().likesMusic(),
                    ctx, VehicleAction.INFOTAINMENT_PLAY, null);
        }
    },

    VOLUME_MATCH {
        @Override
        Optional<Candidate> evaluate(RecommendationContext ctx) {
            CarState car = ctx.carState();
            DriverPreferences prefs = ctx.preferences();
            return when(car.infotainmentOn() && prefs.preferredVolume() != car.volume(),
                    ctx, VehicleAction.INFOTAINMENT_SET_VOLUME, prefs.preferredVolume());
        }
    },

    LIGHTING {
        @Override
        Optional<Candidate> evaluate(RecommendationContext ctx) {
            boolean lightsOn = ctx.carState().lightsOn();
            if (isNight(ctx.localTime())) {
                return when(!lightsOn, ctx, VehicleAction.LIGHTS_TURN_ON, null);
            }
            return when(lightsOn, ctx, VehicleAction.LIGHTS_TURN_OFF, null);
        }
    },

    SEAT_WARMTH {
        @Override
        Optional<Candidate> evaluate(RecommendationContext ctx) {
            return when(!ctx.carState().seatsHeated() && ctx.preferences().likesWarmSeats(),
                    ctx, VehicleAction.SEATS_HEAT_ON, null);
        }
    },

    SEAT_POSITION {
        @Override
        Optional<Candidate> evaluate(RecommendationContext ctx) {
            int preferred = ctx.preferences().preferredSeatPosition();
            return when(preferred != ctx.carState().seatPosition(),
                    ctx, VehicleAction.SEATS_ADJUST, preferred);
        }
    };

    /** First hour counted as evening. */
    static final int EVENING_FROM_HOUR = 18;
    /** Last hour counted as night. */
    static final int NIGHT_UNTIL_HOUR = 6;

    /**
     * An eligible suggestion before phrasing.
     */
    public record Candidate(VehicleAction action, Integer value) {}

    abstract Optional<Candidate> evaluate(RecommendationContext ctx);

    static boolean isNight(LocalTime time) {
        int hour = time.getHour();
        return hour >= EVENING_FROM_HOUR || hour <= NIGHT_UNTIL_HOUR;
    }

    private static Optional<Candidate> when(boolean condition,
                                            RecommendationContext ctx,
                                            VehicleAction action,
                                            Integer value) {
        if (!condition || ctx.recentlyPerformed(action.wireName())) {
            return Optional.empty();
        }
        return Optional.of(new Candidate(action, value));
    }
}
