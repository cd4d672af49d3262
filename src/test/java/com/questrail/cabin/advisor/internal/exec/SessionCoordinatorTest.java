package com.questrail.cabin.advisor.internal.exec;

import com.questrail.cabin.advisor.internal.events.ActionReceived;
import com.questrail.cabin.advisor.internal.recommend.RecommendationContext;
import com.questrail.cabin.advisor.internal.recommend.RecommendationGenerator;
import com.questrail.cabin.advisor.internal.recommend.RuleBasedRecommendationGenerator;
import com.questrail.cabin.advisor.internal.recommend.TemplateChooser;
import com.questrail.cabin.advisor.internal.recommend.TemplatePhrasingStrategy;
import com.questrail.cabin.advisor.internal.state.AdvisorSnapshot;
import com.questrail.cabin.advisor.observability.ActionAppliedEvent;
import com.questrail.cabin.advisor.observability.AdvisorErrorEvent;
import com.questrail.cabin.advisor.observability.AdvisorObservabilitySink;
import com.questrail.cabin.advisor.observability.PhaseTransitionEvent;
import com.questrail.cabin.advisor.observability.RecommendationPublishedEvent;
import com.questrail.cabin.advisor.observability.RecordingObservabilitySink;
import com.questrail.cabin.advisor.observability.SessionStatusEvent;
import com.questrail.cabin.advisor.time.DeterministicScheduler;
import com.questrail.cabin.advisor.time.ManualMonotonicClock;
import com.questrail.cabin.advisor.time.ManualWallClock;
import com.questrail.cabin.api.ActionEvent;
import com.questrail.cabin.api.Recommendation;
import com.questrail.cabin.api.SessionPhase;
import com.questrail.cabin.api.VehicleAction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SessionCoordinatorTest
 * -----------------------------------------------------------------------------
 * Drives the coordinator with a manual clock and {@link SessionCoordinator#drain()}
 * to check phase timing, the recommendation cadence, the break reminder and
 * teardown.
 */
class SessionCoordinatorTest {

    private record Sent(List<Recommendation> recommendations, ZonedDateTime timestamp) {}

    private ManualMonotonicClock clock;
    private ManualWallClock wallClock;
    private DeterministicScheduler scheduler;
    private RecordingObservabilitySink sink;
    private List<Sent> sent;
    private RecommendationPublisher publisher;
    private SessionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        wallClock = ManualWallClock.at(LocalDateTime.of(2024, 5, 1, 12, 0));
        scheduler = new DeterministicScheduler(clock);
        sink = new RecordingObservabilitySink();
        sent = new ArrayList<>();
        publisher = (recs, ts) -> sent.add(new Sent(recs, ts));
    }

    @AfterEach
    void tearDown() {
        if (coordinator != null) {
            coordinator.stop();
        }
    }

    private SessionCoordinator create(AdvisorPolicy policy, RecommendationGenerator generator) {
        return new SessionCoordinator(
                generator,
                new TemplatePhrasingStrategy(TemplateChooser.first()),
                publisher,
                clock,
                scheduler,
                wallClock,
                policy,
                sink);
    }

    private SessionCoordinator create(AdvisorPolicy policy) {
        return create(policy, new RuleBasedRecommendationGenerator(new TemplatePhrasingStrategy(TemplateChooser.first())));
    }

    private void settle() {
        while (scheduler.runDueTasks() + coordinator.drain() > 0) {
            // keep going until no timer is due and the queue is empty
        }
    }

    private void advanceSeconds(int seconds) {
        for (int i = 0; i < seconds; i++) {
            clock.advance(Duration.ofSeconds(1));
            wallClock.advance(Duration.ofSeconds(1));
            settle();
        }
    }

    private void action(VehicleAction action, Number value) {
        action(ActionEvent.of(action, wallClock.now(), value));
    }

    private void action(ActionEvent event) {
        coordinator.submit(new ActionReceived(wallClock.now(), event));
        settle();
    }

    private List<Sent> recommendationBatches() {
        return sent.stream()
                .filter(s -> !Recommendation.TAKE_BREAK.equals(s.recommendations().get(0).action()))
                .toList();
    }

    private List<Sent> breakReminders() {
        return sent.stream()
                .filter(s -> Recommendation.TAKE_BREAK.equals(s.recommendations().get(0).action()))
                .toList();
    }

    @Test
    void startsIdleWithDefaults() {
        coordinator = create(AdvisorPolicy.defaults());

        AdvisorSnapshot snapshot = coordinator.currentSnapshot();
        assertEquals(SessionPhase.IDLE, snapshot.phase());
        assertEquals(0, snapshot.historySize());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void firstActionStartsLearningAndActivatesAfterLearningPeriod() {
        coordinator = create(AdvisorPolicy.defaults());
        Instant t = wallClock.now();

        action(VehicleAction.LIGHTS_DIM, null);

        AdvisorSnapshot learning = coordinator.currentSnapshot();
        assertEquals(SessionPhase.LEARNING, learning.phase());
        assertEquals(t, learning.session().startTime().orElseThrow());
        assertEquals(3, scheduler.pendingCount(), "learning, break reminder and status timers");

        advanceSeconds(29);
        assertEquals(SessionPhase.LEARNING, coordinator.currentSnapshot().phase());
        assertTrue(sent.isEmpty());

        advanceSeconds(1);
        assertEquals(SessionPhase.ACTIVE, coordinator.currentSnapshot().phase());
        assertEquals(1, recommendationBatches().size(), "first cycle runs on activation");
        assertEquals("climate_turn_on", recommendationBatches().get(0).recommendations().get(0).action());

        List<PhaseTransitionEvent> transitions = sink.eventsOfType(PhaseTransitionEvent.class);
        assertEquals(2, transitions.size());
        assertEquals(SessionPhase.LEARNING, transitions.get(0).newPhase());
        assertEquals(SessionPhase.ACTIVE, transitions.get(1).newPhase());
        assertFalse(transitions.get(1).early());
    }

    @Test
    void recommendationsFollowTheInterval() {
        coordinator = create(AdvisorPolicy.defaults());
        action(VehicleAction.LIGHTS_DIM, null);
        advanceSeconds(30);
        assertEquals(1, recommendationBatches().size());

        advanceSeconds(19);
        assertEquals(1, recommendationBatches().size());

        advanceSeconds(1);
        assertEquals(2, recommendationBatches().size());
        assertEquals(2, coordinator.currentSnapshot().session().recommendationsSent());
    }

    @Test
    void earlyCycleWaitsOutTheRestOfTheInterval() {
        coordinator = create(AdvisorPolicy.defaults());
        action(VehicleAction.LIGHTS_DIM, null);
        advanceSeconds(30);
        assertEquals(1, recommendationBatches().size());

        // Re-arm the current cycle 15 s before the interval is up.
        coordinator.recommendationLoop().scheduleAfter(Duration.ofSeconds(5));
        advanceSeconds(5);
        assertEquals(1, recommendationBatches().size(), "cycle inside the cooldown publishes nothing");
        assertEquals(Duration.ofSeconds(15), coordinator.recommendationLoop().cooldownRemaining());

        advanceSeconds(14);
        assertEquals(1, recommendationBatches().size());

        advanceSeconds(1);
        assertEquals(2, recommendationBatches().size(), "deferred cycle runs once the interval has passed");

        advanceSeconds(19);
        assertEquals(2, recommendationBatches().size());
        advanceSeconds(1);
        assertEquals(3, recommendationBatches().size());
    }

    @Test
    void breakReminderIsSentOnceAfterDelay() {
        coordinator = create(AdvisorPolicy.defaults());
        action(VehicleAction.LIGHTS_DIM, null);

        advanceSeconds(199);
        assertTrue(breakReminders().isEmpty());

        advanceSeconds(1);
        assertEquals(1, breakReminders().size());
        assertEquals(1, breakReminders().get(0).recommendations().size());
        assertTrue(coordinator.currentSnapshot().session().breakReminderSent());

        advanceSeconds(300);
        assertEquals(1, breakReminders().size());
    }

    @Test
    void breakReminderIsNotCountedAsRecommendation() {
        coordinator = create(AdvisorPolicy.defaults(), ctx -> List.of());
        action(VehicleAction.LIGHTS_DIM, null);
        advanceSeconds(200);

        assertEquals(1, breakReminders().size());
        assertEquals(0, coordinator.currentSnapshot().session().recommendationsSent());

        RecommendationPublishedEvent published = sink.eventsOfType(RecommendationPublishedEvent.class).get(0);
        assertTrue(published.breakReminder());
        assertEquals(0, published.sequence());
    }

    @Test
    void emptyCyclesAreNotCountedAndLoopKeepsRunning() {
        AtomicInteger calls = new AtomicInteger();
        coordinator = create(AdvisorPolicy.defaults(), ctx -> {
            calls.incrementAndGet();
            return List.of();
        });
        action(VehicleAction.LIGHTS_DIM, null);

        advanceSeconds(130);

        assertEquals(6, calls.get(), "cycles at +30, +50, +70, +90, +110, +130");
        assertTrue(recommendationBatches().isEmpty());
        assertEquals(0, coordinator.currentSnapshot().session().recommendationsSent());
    }

    @Test
    void loopStopsAtSessionCap() {
        coordinator = create(AdvisorPolicy.defaults().withMaxRecommendationsPerSession(2));
        action(VehicleAction.LIGHTS_DIM, null);

        advanceSeconds(400);

        assertEquals(2, recommendationBatches().size());
        assertEquals(2, coordinator.currentSnapshot().session().recommendationsSent());
    }

    @Test
    void zeroCapNeverPublishes() {
        AtomicInteger calls = new AtomicInteger();
        coordinator = create(AdvisorPolicy.defaults().withMaxRecommendationsPerSession(0), ctx -> {
            calls.incrementAndGet();
            return List.of(new Recommendation("climate_turn_on", "msg", null));
        });
        action(VehicleAction.LIGHTS_DIM, null);
        advanceSeconds(100);

        assertEquals(0, calls.get());
        assertTrue(recommendationBatches().isEmpty());
    }

    @Test
    void generatorSeesRecentWindowAndCurrentState() {
        List<RecommendationContext> seen = new ArrayList<>();
        coordinator = create(AdvisorPolicy.defaults(), ctx -> {
            seen.add(ctx);
            return List.of();
        });

        for (String name : List.of("a", "b", "c", "d", "e", "f")) {
            action(ActionEvent.of(name, wallClock.now()));
        }
        action(VehicleAction.CLIMATE_TURN_ON, null);
        advanceSeconds(30);

        RecommendationContext ctx = seen.get(0);
        assertEquals(List.of("c", "d", "e", "f", "climate_turn_on"), ctx.recentActions());
        assertTrue(ctx.carState().climateOn());
        assertEquals(wallClock.localNow().toLocalTime(), ctx.localTime());
    }

    @Test
    void publishFailureIsReportedAndStillCounted() {
        AtomicInteger attempts = new AtomicInteger();
        publisher = (recs, ts) -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("bus down");
        };
        coordinator = create(AdvisorPolicy.defaults());
        action(VehicleAction.LIGHTS_DIM, null);

        advanceSeconds(50);

        assertEquals(2, attempts.get());
        assertEquals(2, coordinator.currentSnapshot().session().recommendationsSent());
        assertEquals(2, sink.eventsOfType(AdvisorErrorEvent.class).size());
        assertFalse(sink.hasEventOfType(RecommendationPublishedEvent.class));
    }

    @Test
    void completeLearningNowActivatesImmediately() {
        coordinator = create(AdvisorPolicy.defaults());
        action(VehicleAction.LIGHTS_DIM, null);

        coordinator.completeLearningNow();
        settle();

        assertEquals(SessionPhase.ACTIVE, coordinator.currentSnapshot().phase());
        assertEquals(1, recommendationBatches().size());
        assertTrue(sink.eventsOfType(PhaseTransitionEvent.class).get(1).early());

        advanceSeconds(30);
        assertEquals(2, sink.eventsOfType(PhaseTransitionEvent.class).size(), "learning timer no longer fires");
    }

    @Test
    void completeLearningNowIsIgnoredWhileIdle() {
        coordinator = create(AdvisorPolicy.defaults());

        coordinator.completeLearningNow();
        settle();

        assertEquals(SessionPhase.IDLE, coordinator.currentSnapshot().phase());
        assertTrue(sink.eventsOfType(PhaseTransitionEvent.class).isEmpty());
    }

    @Test
    void actionsKeepUpdatingStateInEveryPhase() {
        coordinator = create(AdvisorPolicy.defaults());
        action(VehicleAction.CLIMATE_SET_TEMPERATURE, 20);
        action(VehicleAction.CLIMATE_SET_TEMPERATURE, 22);
        advanceSeconds(30);
        action(VehicleAction.CLIMATE_SET_TEMPERATURE, 24);

        AdvisorSnapshot snapshot = coordinator.currentSnapshot();
        assertEquals(SessionPhase.ACTIVE, snapshot.phase());
        assertEquals(24, snapshot.carState().temperature());
        assertEquals(22, snapshot.preferences().preferredTemperature());
        assertEquals(3, snapshot.historySize());
        assertEquals(3, snapshot.actionsProcessed());
    }

    @Test
    void unknownActionIsRecordedWithoutStateChange() {
        coordinator = create(AdvisorPolicy.defaults());
        action(ActionEvent.of("open_sunroof", wallClock.now()));

        AdvisorSnapshot snapshot = coordinator.currentSnapshot();
        assertEquals(SessionPhase.LEARNING, snapshot.phase());
        assertEquals(List.of("open_sunroof"), snapshot.recentActions());

        ActionAppliedEvent applied = sink.eventsOfType(ActionAppliedEvent.class).get(0);
        assertFalse(applied.known());
        assertFalse(applied.stateChanged());
    }

    @Test
    void statusIsReportedPeriodically() {
        coordinator = create(AdvisorPolicy.defaults(), ctx -> List.of());
        action(VehicleAction.LIGHTS_DIM, null);

        advanceSeconds(60);

        List<SessionStatusEvent> reports = sink.eventsOfType(SessionStatusEvent.class);
        assertEquals(2, reports.size());
        assertFalse(reports.get(0).finalReport());
        assertEquals(Duration.ofSeconds(30), reports.get(0).sessionDuration());
        assertEquals(1, reports.get(0).actionsProcessed());
    }

    @Test
    void stopCancelsEveryTimerAndReportsSummary() {
        coordinator = create(AdvisorPolicy.defaults());
        action(VehicleAction.LIGHTS_DIM, null);
        advanceSeconds(30);

        coordinator.stop();

        assertEquals(0, scheduler.pendingCount());
        SessionStatusEvent summary = sink.eventsOfType(SessionStatusEvent.class).stream()
                .filter(SessionStatusEvent::finalReport)
                .findFirst()
                .orElseThrow();
        assertEquals(1, summary.recommendationsSent());
        assertEquals(SessionPhase.ACTIVE, summary.phase());

        int before = sent.size();
        coordinator.submit(new ActionReceived(wallClock.now(), ActionEvent.of("x", wallClock.now())));
        assertEquals(0, coordinator.drain());
        advanceSeconds(300);
        assertEquals(before, sent.size());
    }

    @Test
    void stopDuringFirstActionLeavesNoTimersBehind() {
        AdvisorObservabilitySink stopOnFirstAction = new AdvisorObservabilitySink() {
            @Override
            public void onPhaseTransition(PhaseTransitionEvent event) {
                sink.onPhaseTransition(event);
            }

            @Override
            public void onActionApplied(ActionAppliedEvent event) {
                sink.onActionApplied(event);
                coordinator.stop();
            }

            @Override
            public void onRecommendationPublished(RecommendationPublishedEvent event) {
                sink.onRecommendationPublished(event);
            }

            @Override
            public void onStatus(SessionStatusEvent event) {
                sink.onStatus(event);
            }

            @Override
            public void onError(AdvisorErrorEvent event) {
                sink.onError(event);
            }
        };
        coordinator = new SessionCoordinator(
                new RuleBasedRecommendationGenerator(new TemplatePhrasingStrategy(TemplateChooser.first())),
                new TemplatePhrasingStrategy(TemplateChooser.first()),
                publisher, clock, scheduler, wallClock, AdvisorPolicy.defaults(), stopOnFirstAction);

        coordinator.submit(new ActionReceived(wallClock.now(),
                ActionEvent.of(VehicleAction.LIGHTS_DIM, wallClock.now(), null)));
        assertEquals(1, coordinator.drain());

        assertEquals(0, scheduler.pendingCount());
        advanceSeconds(300);
        assertTrue(sent.isEmpty());
        assertFalse(sink.hasEventOfType(AdvisorErrorEvent.class));
    }

    @Test
    void stopIsIdempotent() {
        coordinator = create(AdvisorPolicy.defaults());
        coordinator.stop();
        coordinator.stop();

        assertEquals(1, sink.eventsOfType(SessionStatusEvent.class).size());
        assertThrows(IllegalStateException.class, coordinator::start);
    }

    @Test
    void eventLoopThreadProcessesSubmittedEvents() throws InterruptedException {
        coordinator = create(AdvisorPolicy.defaults());
        coordinator.start();

        assertThrows(IllegalStateException.class, coordinator::drain);

        coordinator.submit(new ActionReceived(wallClock.now(),
                ActionEvent.of(VehicleAction.CLIMATE_TURN_ON, wallClock.now(), null)));

        long deadline = System.nanoTime() + Duration.ofSeconds(2).toNanos();
        while (coordinator.currentSnapshot().phase() == SessionPhase.IDLE && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }

        assertEquals(SessionPhase.LEARNING, coordinator.currentSnapshot().phase());
        assertTrue(coordinator.currentSnapshot().carState().climateOn());
    }
}
