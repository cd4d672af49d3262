package com.questrail.cabin.advisor.internal.time;

import java.time.Duration;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every session timing decision.
 *
 * <h2>Binding invariant</h2>
 * Learning-period expiry, break-reminder delay, recommendation cooldown and
 * session duration are all measured on this clock. Wall-clock time is used
 * only for payload timestamps and for the time-of-day lighting rule.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();

    /**
     * Elapsed time since an earlier reading of this clock.
     */
    default Duration elapsedSince(long earlierNanos)
    {
        return Duration.ofNanos(Math.max(0L, nowNanos() - earlierNanos));
    }
}
