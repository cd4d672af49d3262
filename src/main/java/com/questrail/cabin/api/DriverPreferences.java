package com.questrail.cabin.api;

import java.util.Objects;
import java.util.Set;

/**
 * The learner's current estimate of the driver's habits.
 *
 * <p>Preferred values are floor means over the set-value actions in the current
 * history window. The boolean flags become {@code true} once their triggering
 * action is seen and are not reset when it later leaves the window.</p>
 */
public record DriverPreferences(
        int preferredTemperature,
        int preferredVolume,
        int preferredSeatPosition,
        boolean likesMusic,
        boolean likesWarmSeats,
        Set<String> commonActions
) {
    public DriverPreferences {
        commonActions = Set.copyOf(Objects.requireNonNull(commonActions, "commonActions"));
    }

    public static DriverPreferences defaults() {
        return new DriverPreferences(22, 50, 5, false, false, Set.of());
    }

    /**
     * Number of preferences currently holding a value, as reported in the
     * session summary: non-zero preferred settings plus flags that are set.
     * Common actions are not counted.
     */
    public int learnedCount() {
        int count = 0;
        if (preferredTemperature != 0) count++;
        if (preferredVolume != 0) count++;
        if (preferredSeatPosition != 0) count++;
        if (likesMusic) count++;
        if (likesWarmSeats) count++;
        return count;
    }
}
