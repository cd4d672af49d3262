package com.questrail.cabin.advisor.internal.exec;

import com.questrail.cabin.advisor.internal.events.AdvisorEvent;
import com.questrail.cabin.advisor.internal.events.SessionTimerEvent;
import com.questrail.cabin.advisor.internal.time.Cancellable;
import com.questrail.cabin.advisor.internal.time.MonotonicClock;
import com.questrail.cabin.advisor.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * RecommendationLoop
 * =============================================================================
 * Cadence owner for the repeating recommendation cycle.
 *
 * <p>The loop does not generate or publish anything itself. Each arming
 * schedules a {@link SessionTimerEvent.RecommendationCycleDue} carrying a
 * sequence number; the coordinator runs the cycle and asks the loop to arm
 * the next one. Only the most recent arming is current, so a cycle event that
 * was already queued when the loop was re-armed or stopped is dropped.</p>
 *
 * <h2>Cooldown</h2>
 * {@link #cooldownRemaining()} reports how much of the interval is left since
 * the last published batch. The coordinator re-arms for that delta instead of
 * sending early.
 *
 * <h2>Thread Safety</h2>
 * Arming and send bookkeeping happen on the coordinator loop. {@link #stop()}
 * may be called from any thread.
 */
public final class RecommendationLoop
{
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Duration interval;
    private final Consumer<AdvisorEvent> eventSink;
    private final Supplier<Instant> wallClock;

    private final AtomicLong lastSequence = new AtomicLong(0);
    private volatile long armedSequence = -1;
    private volatile Cancellable armed = Cancellable.NONE;
    private volatile boolean started;
    private volatile boolean stopped;

    private long lastSendNanos;
    private boolean hasSent;

    public RecommendationLoop(MonotonicScheduler scheduler,
                              MonotonicClock clock,
                              Duration interval,
                              Consumer<AdvisorEvent> eventSink,
                              Supplier<Instant> wallClock)
    {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Starts the loop with an immediate first cycle. Later calls are ignored.
     */
    public void start() {
        if (started || stopped) {
            return;
        }
        started = true;
        scheduleAfter(Duration.ZERO);
    }

    /**
     * Arms the next cycle, superseding any cycle already armed.
     */
    public void scheduleAfter(Duration delay) {
        if (stopped) {
            return;
        }
        armed.cancel();
        long seq = lastSequence.incrementAndGet();
        armedSequence = seq;
        armed = scheduler.scheduleAfter(delay, clock,
                () -> eventSink.accept(new SessionTimerEvent.RecommendationCycleDue(wallClock.get(), seq)));
        if (stopped) {
            armed.cancel();
        }
    }

    /**
     * @return whether a cycle event with this sequence should run
     */
    public boolean isCurrent(long sequence) {
        return started && !stopped && sequence == armedSequence;
    }

    public Duration cooldownRemaining() {
        if (!hasSent) {
            return Duration.ZERO;
        }
        Duration remaining = interval.minus(clock.elapsedSince(lastSendNanos));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public void recordSend() {
        lastSendNanos = clock.nowNanos();
        hasSent = true;
    }

    /**
     * Stops the loop permanently and cancels the armed cycle.
     */
    public void stop() {
        stopped = true;
        armed.cancel();
    }

    public boolean isStarted() {
        return started;
    }

    public boolean isStopped() {
        return stopped;
    }

    public Duration interval() {
        return interval;
    }
}
