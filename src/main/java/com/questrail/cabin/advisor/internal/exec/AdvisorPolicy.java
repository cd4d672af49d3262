package com.questrail.cabin.advisor.internal.exec;

import com.questrail.cabin.advisor.internal.state.ActionHistory;

import java.time.Duration;
import java.util.Objects;

/**
 * AdvisorPolicy
 * -----------------------------------------------------------------------------
 * Operational timing and limits for one advisor session.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>learningPeriod</b>: time from the first action until recommendations
 *       may begin.</li>
 *   <li><b>breakReminderDelay</b>: time from the first action until the single
 *       break reminder is sent.</li>
 *   <li><b>recommendationInterval</b>: spacing between recommendation cycles and
 *       minimum gap between two published recommendation batches.</li>
 *   <li><b>maxRecommendationsPerSession</b>: cap on published batches; the loop
 *       stops for good once reached.</li>
 *   <li><b>historyCapacity</b>: size of the bounded action history.</li>
 *   <li><b>statusInterval</b>: spacing of periodic status reports;
 *       {@link Duration#ZERO} disables them.</li>
 * </ul>
 */
public record AdvisorPolicy(
        Duration learningPeriod,
        Duration breakReminderDelay,
        Duration recommendationInterval,
        int maxRecommendationsPerSession,
        int historyCapacity,
        Duration statusInterval
) {
    public AdvisorPolicy {
        Objects.requireNonNull(learningPeriod, "learningPeriod");
        Objects.requireNonNull(breakReminderDelay, "breakReminderDelay");
        Objects.requireNonNull(recommendationInterval, "recommendationInterval");
        Objects.requireNonNull(statusInterval, "statusInterval");

        if (learningPeriod.isNegative()) {
            throw new IllegalArgumentException("learningPeriod must be non-negative");
        }
        if (breakReminderDelay.isNegative()) {
            throw new IllegalArgumentException("breakReminderDelay must be non-negative");
        }
        if (recommendationInterval.isNegative() || recommendationInterval.isZero()) {
            throw new IllegalArgumentException("recommendationInterval must be positive");
        }
        if (maxRecommendationsPerSession < 0) {
            throw new IllegalArgumentException("maxRecommendationsPerSession must be non-negative");
        }
        if (historyCapacity <= 0) {
            throw new IllegalArgumentException("historyCapacity must be positive");
        }
        if (statusInterval.isNegative()) {
            throw new IllegalArgumentException("statusInterval must be non-negative");
        }
    }

    /**
     * Default values:
     * <ul>
     *   <li>learningPeriod: 30s</li>
     *   <li>breakReminderDelay: 200s</li>
     *   <li>recommendationInterval: 20s</li>
     *   <li>maxRecommendationsPerSession: 50</li>
     *   <li>historyCapacity: 50</li>
     *   <li>statusInterval: 30s</li>
     * </ul>
     */
    public static AdvisorPolicy defaults() {
        return new AdvisorPolicy(
                Duration.ofSeconds(30),
                Duration.ofSeconds(200),
                Duration.ofSeconds(20),
                50,
                ActionHistory.DEFAULT_CAPACITY,
                Duration.ofSeconds(30)
        );
    }

    public AdvisorPolicy withLearningPeriod(Duration d) {
        return new AdvisorPolicy(d, breakReminderDelay, recommendationInterval,
                maxRecommendationsPerSession, historyCapacity, statusInterval);
    }

    public AdvisorPolicy withBreakReminderDelay(Duration d) {
        return new AdvisorPolicy(learningPeriod, d, recommendationInterval,
                maxRecommendationsPerSession, historyCapacity, statusInterval);
    }

    public AdvisorPolicy withRecommendationInterval(Duration d) {
        return new AdvisorPolicy(learningPeriod, breakReminderDelay, d,
                maxRecommendationsPerSession, historyCapacity, statusInterval);
    }

    public AdvisorPolicy withMaxRecommendationsPerSession(int max) {
        return new AdvisorPolicy(learningPeriod, breakReminderDelay, recommendationInterval,
                max, historyCapacity, statusInterval);
    }

    public AdvisorPolicy withStatusInterval(Duration d) {
        return new AdvisorPolicy(learningPeriod, breakReminderDelay, recommendationInterval,
                maxRecommendationsPerSession, historyCapacity, d);
    }
}
