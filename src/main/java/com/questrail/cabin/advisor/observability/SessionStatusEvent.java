package com.questrail.cabin.advisor.observability;

import com.questrail.cabin.api.SessionPhase;

import java.time.Duration;
import java.time.Instant;

/**
 * Record representing a session status report.
 *
 * @param finalReport {@code true} for the summary emitted when the session stops
 */
public record SessionStatusEvent(
    Instant timestamp,
    SessionPhase phase,
    Duration sessionDuration,
    long actionsProcessed,
    int recommendationsSent,
    int learnedPreferences,
    boolean finalReport
) {
}
