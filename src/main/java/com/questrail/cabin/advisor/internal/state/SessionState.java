package com.questrail.cabin.advisor.internal.state;

import com.questrail.cabin.api.SessionPhase;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * SessionState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of the session bookkeeping owned by the coordinator.
 *
 * <p>Transitions return a new instance; the coordinator swaps its reference
 * under the state lock. Phase only moves forward
 * ({@code IDLE -> LEARNING -> ACTIVE}).</p>
 */
public final class SessionState
{
    private final SessionPhase phase;
    private final Instant startTime;
    private final int recommendationsSent;
    private final Instant lastRecommendationTime;
    private final boolean breakReminderSent;

    private SessionState(SessionPhase phase,
                         Instant startTime,
                         int recommendationsSent,
                         Instant lastRecommendationTime,
                         boolean breakReminderSent) {
        this.phase = Objects.requireNonNull(phase, "phase");
        this.startTime = startTime;
        this.recommendationsSent = recommendationsSent;
        this.lastRecommendationTime = lastRecommendationTime;
        this.breakReminderSent = breakReminderSent;
    }

    public static SessionState idle() {
        return new SessionState(SessionPhase.IDLE, null, 0, null, false);
    }

    public SessionPhase phase() {
        return phase;
    }

    public Optional<Instant> startTime() {
        return Optional.ofNullable(startTime);
    }

    public int recommendationsSent() {
        return recommendationsSent;
    }

    public Optional<Instant> lastRecommendationTime() {
        return Optional.ofNullable(lastRecommendationTime);
    }

    public boolean breakReminderSent() {
        return breakReminderSent;
    }

    // ---------------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------------

    public SessionState startLearning(Instant now) {
        requirePhase(SessionPhase.IDLE);
        return new SessionState(SessionPhase.LEARNING, Objects.requireNonNull(now, "now"),
                recommendationsSent, lastRecommendationTime, breakReminderSent);
    }

    public SessionState activate() {
        requirePhase(SessionPhase.LEARNING);
        return new SessionState(SessionPhase.ACTIVE, startTime,
                recommendationsSent, lastRecommendationTime, breakReminderSent);
    }

    public SessionState withRecommendationSent(Instant now) {
        return new SessionState(phase, startTime,
                recommendationsSent + 1, Objects.requireNonNull(now, "now"), breakReminderSent);
    }

    public SessionState withBreakReminderSent() {
        return new SessionState(phase, startTime, recommendationsSent, lastRecommendationTime, true);
    }

    private void requirePhase(SessionPhase expected) {
        if (phase != expected) {
            throw new IllegalStateException("Expected phase " + expected + " but was " + phase);
        }
    }

    @Override
    public String toString() {
        return "SessionState{phase=" + phase
                + ", startTime=" + startTime
                + ", recommendationsSent=" + recommendationsSent
                + ", lastRecommendationTime=" + lastRecommendationTime
                + ", breakReminderSent=" + breakReminderSent + '}';
    }
}
