package com.questrail.cabin.advisor.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a scheduled advisor timer (learning period, break reminder,
 * recommendation cycle, status report).
 *
 * <p>
 * Every timer the session arms is held through one of these handles so that
 * session teardown can cancel it before the scheduler executor goes away.
 * </p>
 */
public interface Cancellable
{
    /**
     * A handle that refers to nothing. Cancelling it is a no-op.
     */
    Cancellable NONE = () -> false;

    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
