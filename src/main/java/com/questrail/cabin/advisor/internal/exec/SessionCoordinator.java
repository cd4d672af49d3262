package com.questrail.cabin.advisor.internal.exec;

import com.questrail.cabin.advisor.internal.events.ActionReceived;
import com.questrail.cabin.advisor.internal.events.AdvisorEvent;
import com.questrail.cabin.advisor.internal.events.SessionTimerEvent;
import com.questrail.cabin.advisor.internal.recommend.PhrasingStrategy;
import com.questrail.cabin.advisor.internal.recommend.RecommendationContext;
import com.questrail.cabin.advisor.internal.recommend.RecommendationGenerator;
import com.questrail.cabin.advisor.internal.state.ActionHistory;
import com.questrail.cabin.advisor.internal.state.AdvisorSnapshot;
import com.questrail.cabin.advisor.internal.state.CarStateReducer;
import com.questrail.cabin.advisor.internal.state.PreferenceLearner;
import com.questrail.cabin.advisor.internal.state.SessionState;
import com.questrail.cabin.advisor.internal.time.Cancellable;
import com.questrail.cabin.advisor.internal.time.MonotonicClock;
import com.questrail.cabin.advisor.internal.time.MonotonicScheduler;
import com.questrail.cabin.advisor.internal.time.WallClock;
import com.questrail.cabin.advisor.observability.ActionAppliedEvent;
import com.questrail.cabin.advisor.observability.AdvisorErrorEvent;
import com.questrail.cabin.advisor.observability.AdvisorObservabilitySink;
import com.questrail.cabin.advisor.observability.NullObservabilitySink;
import com.questrail.cabin.advisor.observability.PhaseTransitionEvent;
import com.questrail.cabin.advisor.observability.RecommendationPublishedEvent;
import com.questrail.cabin.advisor.observability.SessionStatusEvent;
import com.questrail.cabin.api.ActionEvent;
import com.questrail.cabin.api.CarState;
import com.questrail.cabin.api.DriverPreferences;
import com.questrail.cabin.api.Recommendation;
import com.questrail.cabin.api.SessionPhase;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SessionCoordinator
 * =============================================================================
 * Serialized event loop that owns all per-session advisor state.
 *
 * <h2>Purpose</h2>
 * Inbound actions and every timer expiry are posted to one queue and applied
 * one at a time. The coordinator is the only writer of:
 * <ul>
 *   <li>the {@link SessionState} (phase, counters, break flag)</li>
 *   <li>the {@link CarState}</li>
 *   <li>the {@link ActionHistory}</li>
 *   <li>the {@link DriverPreferences}</li>
 * </ul>
 *
 * <h2>Session Lifecycle</h2>
 * <pre>
 *   IDLE --first action--> LEARNING --learning period / completeLearningNow--> ACTIVE
 * </pre>
 * The first action starts the learning timer, arms the break reminder and
 * starts status reporting. Entering ACTIVE starts the recommendation loop.
 * Phase never moves backwards.
 *
 * <h2>Threading Model</h2>
 * {@link #start()} runs the loop on its own thread. {@link #drain()} processes
 * queued events on the caller's thread instead and is meant for deterministic
 * tests driven by a manual scheduler. Publishing happens outside the state
 * lock so a slow bus never blocks {@link #currentSnapshot()}.
 */
public final class SessionCoordinator {

    /** Number of actions in the recent window handed to the generator. */
    public static final int RECENT_WINDOW = 5;

    private final CarStateReducer carStateReducer = new CarStateReducer();
    private final PreferenceLearner preferenceLearner = new PreferenceLearner();

    private final RecommendationGenerator generator;
    private final PhrasingStrategy phrasing;
    private final RecommendationPublisher publisher;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final AdvisorPolicy policy;
    private final AdvisorObservabilitySink observabilitySink;

    private final BreakReminderScheduler breakReminder;
    private final RecommendationLoop recommendationLoop;

    private final BlockingQueue<AdvisorEvent> eventQueue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final Object stateLock = new Object();

    // Guarded by stateLock.
    private SessionState session = SessionState.idle();
    private CarState carState = CarState.defaults();
    private DriverPreferences preferences = DriverPreferences.defaults();
    private final ActionHistory history;
    private long actionsProcessed;
    private long sessionStartNanos;

    private volatile Cancellable learningTimer = Cancellable.NONE;
    private volatile Cancellable statusTimer = Cancellable.NONE;
    private volatile Thread eventLoopThread;

    public SessionCoordinator(RecommendationGenerator generator,
                              PhrasingStrategy phrasing,
                              RecommendationPublisher publisher,
                              MonotonicClock clock,
                              MonotonicScheduler scheduler,
                              WallClock wallClock,
                              AdvisorPolicy policy,
                              AdvisorObservabilitySink observabilitySink)
    {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.phrasing = Objects.requireNonNull(phrasing, "phrasing");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        this.history = new ActionHistory(policy.historyCapacity());
        this.breakReminder = new BreakReminderScheduler(
                scheduler, clock, policy.breakReminderDelay(), this::submit, wallClock::now);
        this.recommendationLoop = new RecommendationLoop(
                scheduler, clock, policy.recommendationInterval(), this::submit, wallClock::now);
    }

    /**
     * Starts the event loop thread. Calling it again has no effect.
     *
     * @throws IllegalStateException if the coordinator was already stopped
     */
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("Coordinator already stopped");
        }
        if (running.compareAndSet(false, true)) {
            eventLoopThread = new Thread(this::runEventLoop, "cabin-advisor-session");
            eventLoopThread.setDaemon(true);
            eventLoopThread.start();
        }
    }

    /**
     * Stops the session: cancels every timer, stops the loop thread and emits
     * the final session summary. Only the first call has any effect.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        learningTimer.cancel();
        statusTimer.cancel();
        breakReminder.cancel();
        recommendationLoop.stop();

        if (running.compareAndSet(true, false) && eventLoopThread != null) {
            eventLoopThread.interrupt();
            try {
                eventLoopThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        eventQueue.clear();

        observabilitySink.onStatus(statusEvent(true));
    }

    /**
     * Enqueues an event. Events submitted after {@link #stop()} are dropped.
     */
    public void submit(AdvisorEvent event) {
        Objects.requireNonNull(event, "event");
        if (!stopped.get()) {
            eventQueue.offer(event);
        }
    }

    /**
     * Processes every queued event on the calling thread, including events
     * enqueued while draining.
     *
     * @return number of events processed
     * @throws IllegalStateException if the loop thread is running
     */
    public int drain() {
        if (running.get()) {
            throw new IllegalStateException("drain() is not available while the event loop thread runs");
        }
        int processed = 0;
        AdvisorEvent event;
        while (!stopped.get() && (event = eventQueue.poll()) != null) {
            processSafely(event);
            processed++;
        }
        return processed;
    }

    /**
     * Requests the LEARNING to ACTIVE transition without waiting for the
     * learning timer. Ignored unless the session is learning.
     */
    public void completeLearningNow() {
        submit(new SessionTimerEvent.LearningPeriodElapsed(wallClock.now(), true));
    }

    public AdvisorSnapshot currentSnapshot() {
        synchronized (stateLock) {
            return new AdvisorSnapshot(session, carState, preferences,
                    history.recentWindow(RECENT_WINDOW), history.size(), actionsProcessed);
        }
    }

    public AdvisorPolicy policy() {
        return policy;
    }

    RecommendationLoop recommendationLoop() {
        return recommendationLoop;
    }

    // ---------------------------------------------------------------------
    // Event loop
    // ---------------------------------------------------------------------

    private void runEventLoop() {
        while (running.get()) {
            try {
                AdvisorEvent event = eventQueue.take();
                if (running.get()) {
                    processSafely(event);
                }
            } catch (InterruptedException e) {
                if (running.get()) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    private void processSafely(AdvisorEvent event) {
        try {
            process(event);
        } catch (RuntimeException e) {
            observabilitySink.onError(new AdvisorErrorEvent(wallClock.now(), "Event processing error: " + event, e));
        }
    }

    private void process(AdvisorEvent event) {
        if (event instanceof ActionReceived received) {
            onAction(received.action());
        } else if (event instanceof SessionTimerEvent.LearningPeriodElapsed elapsed) {
            onLearningPeriodElapsed(elapsed);
        } else if (event instanceof SessionTimerEvent.BreakReminderDue) {
            onBreakReminderDue();
        } else if (event instanceof SessionTimerEvent.RecommendationCycleDue due) {
            onRecommendationCycleDue(due);
        } else if (event instanceof SessionTimerEvent.StatusReportDue) {
            onStatusReportDue();
        } else {
            throw new IllegalArgumentException("Unsupported event: " + event.getClass().getName());
        }
    }

    private void onAction(ActionEvent action) {
        final CarState before;
        final CarState after;
        final int historySize;
        final boolean firstAction;

        synchronized (stateLock) {
            before = carState;
            history.append(action);
            carState = carStateReducer.apply(carState, action);
            actionsProcessed++;

            firstAction = session.phase() == SessionPhase.IDLE;
            if (firstAction) {
                session = session.startLearning(wallClock.now());
                sessionStartNanos = clock.nowNanos();
            }

            preferences = preferenceLearner.recompute(preferences, history.events());
            after = carState;
            historySize = history.size();
        }

        observabilitySink.onActionApplied(new ActionAppliedEvent(
                action, action.knownAction().isPresent(), !before.equals(after), after, historySize));

        if (firstAction) {
            observabilitySink.onPhaseTransition(new PhaseTransitionEvent(
                    wallClock.now(), SessionPhase.IDLE, SessionPhase.LEARNING, false));
            startSessionTimers();
        }
    }

    private void startSessionTimers() {
        if (stopped.get()) {
            return;
        }
        learningTimer = scheduler.scheduleAfter(policy.learningPeriod(), clock,
                () -> submit(new SessionTimerEvent.LearningPeriodElapsed(wallClock.now(), false)));
        breakReminder.arm();
        scheduleStatusReport();

        // stop() may have run while the timers were being armed.
        if (stopped.get()) {
            learningTimer.cancel();
            breakReminder.cancel();
            statusTimer.cancel();
        }
    }

    private void onLearningPeriodElapsed(SessionTimerEvent.LearningPeriodElapsed event) {
        synchronized (stateLock) {
            if (session.phase() != SessionPhase.LEARNING) {
                return;
            }
            session = session.activate();
        }

        learningTimer.cancel();
        observabilitySink.onPhaseTransition(new PhaseTransitionEvent(
                wallClock.now(), SessionPhase.LEARNING, SessionPhase.ACTIVE, event.early()));
        recommendationLoop.start();
    }

    private void onBreakReminderDue() {
        if (!breakReminder.tryFire()) {
            return;
        }
        synchronized (stateLock) {
            session = session.withBreakReminderSent();
        }
        publishSafely(List.of(Recommendation.breakReminder(phrasing.breakReminder())), 0, true);
    }

    private void onRecommendationCycleDue(SessionTimerEvent.RecommendationCycleDue event) {
        if (!recommendationLoop.isCurrent(event.sequence())) {
            return;
        }

        final RecommendationContext context;
        final int sent;
        synchronized (stateLock) {
            if (session.phase() != SessionPhase.ACTIVE) {
                return;
            }
            sent = session.recommendationsSent();
            context = new RecommendationContext(carState, preferences,
                    history.recentWindow(RECENT_WINDOW), wallClock.localNow().toLocalTime());
        }

        if (sent >= policy.maxRecommendationsPerSession()) {
            recommendationLoop.stop();
            return;
        }

        Duration remaining = recommendationLoop.cooldownRemaining();
        if (!remaining.isZero()) {
            recommendationLoop.scheduleAfter(remaining);
            return;
        }

        List<Recommendation> recommendations = generator.generate(context);
        if (!recommendations.isEmpty()) {
            final int sequence;
            synchronized (stateLock) {
                session = session.withRecommendationSent(wallClock.now());
                sequence = session.recommendationsSent();
            }
            recommendationLoop.recordSend();
            publishSafely(recommendations, sequence, false);

            if (sequence >= policy.maxRecommendationsPerSession()) {
                recommendationLoop.stop();
                return;
            }
        }

        recommendationLoop.scheduleAfter(policy.recommendationInterval());
    }

    private void onStatusReportDue() {
        observabilitySink.onStatus(statusEvent(false));
        scheduleStatusReport();
    }

    private void scheduleStatusReport() {
        if (stopped.get() || policy.statusInterval().isZero()) {
            return;
        }
        statusTimer = scheduler.scheduleAfter(policy.statusInterval(), clock,
                () -> submit(new SessionTimerEvent.StatusReportDue(wallClock.now())));
    }

    private void publishSafely(List<Recommendation> recommendations, int sequence, boolean isBreakReminder) {
        try {
            publisher.publish(new ArrayList<>(recommendations), wallClock.localNow());
            observabilitySink.onRecommendationPublished(new RecommendationPublishedEvent(
                    wallClock.now(), sequence, recommendations, isBreakReminder));
        } catch (RuntimeException e) {
            observabilitySink.onError(new AdvisorErrorEvent(
                    wallClock.now(),
                    isBreakReminder ? "Failed to publish break reminder" : "Failed to publish recommendations #" + sequence,
                    e));
        }
    }

    private SessionStatusEvent statusEvent(boolean finalReport) {
        synchronized (stateLock) {
            Duration duration = session.startTime().isPresent()
                    ? clock.elapsedSince(sessionStartNanos)
                    : Duration.ZERO;
            return new SessionStatusEvent(
                    wallClock.now(),
                    session.phase(),
                    duration,
                    actionsProcessed,
                    session.recommendationsSent(),
                    preferences.learnedCount(),
                    finalReport);
        }
    }
}
