package com.questrail.cabin.advisor.internal.events;

import java.time.Instant;

/**
 * SessionTimerEvent
 * -----------------------------------------------------------------------------
 * Events injected by the session's timers. The timers themselves never touch
 * session state; they only post one of these.
 *
 * <p>Any of these may arrive late or more than once (a cancelled timer whose
 * event was already queued, a manual learning completion racing the timer).
 * The coordinator guards each on phase and armed state.</p>
 */
public sealed interface SessionTimerEvent extends AdvisorEvent
        permits SessionTimerEvent.LearningPeriodElapsed,
                SessionTimerEvent.BreakReminderDue,
                SessionTimerEvent.RecommendationCycleDue,
                SessionTimerEvent.StatusReportDue
{
    /** Learning phase is over; {@code early} when requested explicitly rather than by the timer. */
    final class LearningPeriodElapsed extends AdvisorEvent.Base implements SessionTimerEvent {
        private final boolean early;

        public LearningPeriodElapsed(Instant timestamp, boolean early) {
            super(timestamp);
            this.early = early;
        }

        public boolean early() {
            return early;
        }
    }

    /** The break-reminder delay expired. */
    final class BreakReminderDue extends AdvisorEvent.Base implements SessionTimerEvent {
        public BreakReminderDue(Instant timestamp) {
            super(timestamp);
        }
    }

    /**
     * A recommendation cycle is due. {@code sequence} identifies the arming
     * that produced it so superseded cycles can be dropped.
     */
    final class RecommendationCycleDue extends AdvisorEvent.Base implements SessionTimerEvent {
        private final long sequence;

        public RecommendationCycleDue(Instant timestamp, long sequence) {
            super(timestamp);
            this.sequence = sequence;
        }

        public long sequence() {
            return sequence;
        }
    }

    /** Periodic status report is due. */
    final class StatusReportDue extends AdvisorEvent.Base implements SessionTimerEvent {
        public StatusReportDue(Instant timestamp) {
            super(timestamp);
        }
    }
}
