package com.questrail.cabin.advisor.runtime;

import com.questrail.cabin.advisor.codec.ActionEventDecoder;
import com.questrail.cabin.advisor.codec.RecommendationEnvelopeEncoder;
import com.questrail.cabin.advisor.config.AdvisorRuntimeConfig;
import com.questrail.cabin.advisor.config.BusConfig;
import com.questrail.cabin.advisor.internal.exec.SessionCoordinator;
import com.questrail.cabin.advisor.internal.recommend.PhrasingStrategy;
import com.questrail.cabin.advisor.internal.recommend.RecommendationGenerator;
import com.questrail.cabin.advisor.internal.recommend.RuleBasedRecommendationGenerator;
import com.questrail.cabin.advisor.internal.recommend.TemplatePhrasingStrategy;
import com.questrail.cabin.advisor.internal.state.AdvisorSnapshot;
import com.questrail.cabin.advisor.internal.time.MonotonicClock;
import com.questrail.cabin.advisor.internal.time.MonotonicScheduler;
import com.questrail.cabin.advisor.internal.time.ScheduledExecutorScheduler;
import com.questrail.cabin.advisor.internal.time.SystemMonotonicClock;
import com.questrail.cabin.advisor.internal.time.SystemWallClock;
import com.questrail.cabin.advisor.internal.time.WallClock;
import com.questrail.cabin.advisor.observability.AdvisorObservabilitySink;
import com.questrail.cabin.advisor.observability.Slf4jAdvisorObservabilitySink;
import com.questrail.cabin.advisor.transport.BusConnector;
import com.questrail.cabin.advisor.transport.BusEndpoint;
import com.questrail.cabin.advisor.transport.mqtt.netty.NettyMqttBusEndpoint;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * AdvisorProductionRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the production advisor stack.
 */
public final class AdvisorProductionRuntime {
    private final SessionCoordinator coordinator;
    private final AdvisorBusRuntime busRuntime;
    private final ScheduledExecutorService schedulerExecutor;

    private AdvisorProductionRuntime(SessionCoordinator coordinator,
                                     AdvisorBusRuntime busRuntime,
                                     ScheduledExecutorService schedulerExecutor) {
        this.coordinator = coordinator;
        this.busRuntime = busRuntime;
        this.schedulerExecutor = schedulerExecutor;
    }

    /**
     * Connects to the bus, then starts the session loop. On connection failure
     * everything already created is released before the exception propagates.
     *
     * @throws com.questrail.cabin.advisor.transport.BusConnectException if the bus cannot be reached
     */
    public void start() {
        try {
            busRuntime.start();
        } catch (RuntimeException e) {
            busRuntime.stop();
            shutdownScheduler();
            throw e;
        }
        coordinator.start();
    }

    public void stop() {
        busRuntime.stop();
        coordinator.stop();
        shutdownScheduler();
    }

    public AdvisorSnapshot currentSnapshot() {
        return coordinator.currentSnapshot();
    }

    public void completeLearningNow() {
        coordinator.completeLearningNow();
    }

    private void shutdownScheduler() {
        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private AdvisorRuntimeConfig config = AdvisorRuntimeConfig.builder().build();
        private AdvisorObservabilitySink observabilitySink;
        private PhrasingStrategy phrasing;
        private RecommendationGenerator generator;
        private BusEndpoint endpoint;
        private BusConnector.Sleeper connectSleeper = BusConnector.Sleeper.THREAD;

        public Builder withConfig(AdvisorRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(AdvisorObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withPhrasing(PhrasingStrategy phrasing) {
            this.phrasing = phrasing;
            return this;
        }

        public Builder withGenerator(RecommendationGenerator generator) {
            this.generator = generator;
            return this;
        }

        /**
         * Replaces the Netty MQTT endpoint, e.g. with an in-memory bus.
         */
        public Builder withEndpoint(BusEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder withConnectSleeper(BusConnector.Sleeper sleeper) {
            this.connectSleeper = sleeper;
            return this;
        }

        public AdvisorProductionRuntime build() {
            Objects.requireNonNull(config, "config");
            BusConfig bus = config.bus();

            // 1. Time
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            WallClock wallClock = new SystemWallClock(config.zone());
            ScheduledExecutorService schedulerExec = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "cabin-advisor-timers");
                t.setDaemon(true);
                return t;
            });
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            // 2. Transport
            BusEndpoint effectiveEndpoint = endpoint != null
                    ? endpoint
                    : new NettyMqttBusEndpoint(
                            InetSocketAddress.createUnresolved(bus.host(), bus.port()),
                            bus.clientId(),
                            bus.keepAlive(),
                            bus.connectTimeout());

            // 3. Session
            PhrasingStrategy effectivePhrasing = phrasing != null ? phrasing : TemplatePhrasingStrategy.randomized();
            RecommendationGenerator effectiveGenerator = generator != null
                    ? generator
                    : new RuleBasedRecommendationGenerator(effectivePhrasing);
            AdvisorObservabilitySink sink = observabilitySink != null
                    ? observabilitySink
                    : new Slf4jAdvisorObservabilitySink();

            SessionCoordinator coordinator = new SessionCoordinator(
                    effectiveGenerator,
                    effectivePhrasing,
                    new BusRecommendationPublisher(effectiveEndpoint, new RecommendationEnvelopeEncoder(), bus.recommendationsTopic()),
                    clock,
                    scheduler,
                    wallClock,
                    config.policy(),
                    sink);

            // 4. Inbound wiring
            AdvisorBusRuntime busRuntime = new AdvisorBusRuntime(
                    effectiveEndpoint,
                    new BusConnector(bus.connectAttempts(), bus.connectBackoff(), connectSleeper),
                    new ActionEventDecoder(wallClock),
                    bus.actionsTopic(),
                    wallClock,
                    coordinator::submit);

            return new AdvisorProductionRuntime(coordinator, busRuntime, schedulerExec);
        }
    }
}
