package com.questrail.cabin.advisor.internal.recommend;

import com.questrail.cabin.api.CarState;
import com.questrail.cabin.api.DriverPreferences;

import java.time.LocalTime;
import java.util.List;
import java.util.Objects;

/**
 * Inputs to one recommendation pass.
 *
 * @param carState      car state at generation time
 * @param preferences   preference profile at generation time
 * @param recentActions recent window (last five action names, oldest first)
 * @param localTime     local wall-clock time, used by the lighting rule
 */
public record RecommendationContext(
        CarState carState,
        DriverPreferences preferences,
        List<String> recentActions,
        LocalTime localTime
) {
    /** Number of most recent actions that suppress a suggestion. */
    public static final int SUPPRESSION_DEPTH = 3;

    public RecommendationContext {
        Objects.requireNonNull(carState, "carState");
        Objects.requireNonNull(preferences, "preferences");
        Objects.requireNonNull(localTime, "localTime");
        recentActions = List.copyOf(recentActions);
    }

    /**
     * Last {@link #SUPPRESSION_DEPTH} entries of the recent window.
     */
    public List<String> suppressionSet() {
        int from = Math.max(0, recentActions.size() - SUPPRESSION_DEPTH);
        return recentActions.subList(from, recentActions.size());
    }

    public boolean recentlyPerformed(String action) {
        return suppressionSet().contains(action);
    }
}
