package com.questrail.cabin.advisor.internal.exec;

import com.questrail.cabin.advisor.internal.events.AdvisorEvent;
import com.questrail.cabin.advisor.internal.events.SessionTimerEvent;
import com.questrail.cabin.advisor.internal.time.Cancellable;
import com.questrail.cabin.advisor.internal.time.MonotonicClock;
import com.questrail.cabin.advisor.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * BreakReminderScheduler
 * =============================================================================
 * One-shot break reminder: {@code UNARMED -> ARMED -> FIRED}.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>{@link #arm()} schedules a {@link SessionTimerEvent.BreakReminderDue}
 *       after the configured delay. Arming twice has no effect.</li>
 *   <li>{@link #tryFire()} is called by the coordinator when that event is
 *       processed. Only the first call after arming succeeds, so duplicate
 *       expiry events can never produce a second reminder.</li>
 *   <li>{@link #cancel()} moves any non-fired state to {@code CANCELLED}.</li>
 * </ul>
 */
public final class BreakReminderScheduler
{
    public enum State {
        UNARMED,
        ARMED,
        FIRED,
        CANCELLED
    }

    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Duration delay;
    private final Consumer<AdvisorEvent> eventSink;
    private final Supplier<Instant> wallClock;

    private final AtomicReference<State> state = new AtomicReference<>(State.UNARMED);
    private volatile Cancellable timer = Cancellable.NONE;

    public BreakReminderScheduler(MonotonicScheduler scheduler,
                                  MonotonicClock clock,
                                  Duration delay,
                                  Consumer<AdvisorEvent> eventSink,
                                  Supplier<Instant> wallClock)
    {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.delay = Objects.requireNonNull(delay, "delay");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * @return {@code true} if this call armed the reminder
     */
    public boolean arm() {
        if (!state.compareAndSet(State.UNARMED, State.ARMED)) {
            return false;
        }
        timer = scheduler.scheduleAfter(delay, clock,
                () -> eventSink.accept(new SessionTimerEvent.BreakReminderDue(wallClock.get())));
        if (state.get() == State.CANCELLED) {
            timer.cancel();
        }
        return true;
    }

    /**
     * @return {@code true} exactly once per session, when the armed reminder fires
     */
    public boolean tryFire() {
        return state.compareAndSet(State.ARMED, State.FIRED);
    }

    public void cancel() {
        timer.cancel();
        state.updateAndGet(s -> s == State.FIRED ? s : State.CANCELLED);
    }

    public State state() {
        return state.get();
    }
}
