package com.questrail.cabin.advisor.observability;

import com.questrail.cabin.api.SessionPhase;

import java.time.Instant;

/**
 * Record representing a session phase change.
 *
 * @param early {@code true} when learning was completed on request rather than by its timer
 */
public record PhaseTransitionEvent(
    Instant timestamp,
    SessionPhase oldPhase,
    SessionPhase newPhase,
    boolean early
) {
}
