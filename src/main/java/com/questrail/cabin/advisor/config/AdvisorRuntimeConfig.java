package com.questrail.cabin.advisor.config;

import com.questrail.cabin.advisor.internal.exec.AdvisorPolicy;

import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated configuration for the advisor production runtime.
 */
public record AdvisorRuntimeConfig(
    BusConfig bus,
    AdvisorPolicy policy,
    ZoneId zone
) {
    public static final String ENV_LEARNING_PERIOD = "ADVISOR_LEARNING_PERIOD_SECONDS";
    public static final String ENV_RECOMMENDATION_INTERVAL = "ADVISOR_RECOMMENDATION_INTERVAL_SECONDS";
    public static final String ENV_BREAK_REMINDER = "ADVISOR_BREAK_REMINDER_SECONDS";
    public static final String ENV_MAX_RECOMMENDATIONS = "ADVISOR_MAX_RECOMMENDATIONS";
    public static final String ENV_ZONE = "ADVISOR_ZONE";

    public AdvisorRuntimeConfig {
        Objects.requireNonNull(bus, "bus");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(zone, "zone");
    }

    /**
     * Builds the configuration from process environment variables. Bus
     * settings are read by {@link BusConfig#fromEnvironment(Map)}; policy
     * overrides are given in whole seconds.
     *
     * @throws IllegalArgumentException if a present value cannot be used
     */
    public static AdvisorRuntimeConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");

        AdvisorPolicy policy = AdvisorPolicy.defaults();
        policy = EnvironmentValues.seconds(env, ENV_LEARNING_PERIOD).map(policy::withLearningPeriod).orElse(policy);
        policy = EnvironmentValues.seconds(env, ENV_RECOMMENDATION_INTERVAL).map(policy::withRecommendationInterval).orElse(policy);
        policy = EnvironmentValues.seconds(env, ENV_BREAK_REMINDER).map(policy::withBreakReminderDelay).orElse(policy);
        policy = EnvironmentValues.integer(env, ENV_MAX_RECOMMENDATIONS).map(policy::withMaxRecommendationsPerSession).orElse(policy);

        return builder()
                .withBus(BusConfig.fromEnvironment(env))
                .withPolicy(policy)
                .withZone(EnvironmentValues.zone(env, ENV_ZONE).orElse(ZoneId.systemDefault()))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private BusConfig bus;
        private AdvisorPolicy policy = AdvisorPolicy.defaults();
        private ZoneId zone = ZoneId.systemDefault();

        public Builder withBus(BusConfig bus) {
            this.bus = bus;
            return this;
        }

        public Builder withPolicy(AdvisorPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder withZone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public AdvisorRuntimeConfig build() {
            return new AdvisorRuntimeConfig(bus != null ? bus : BusConfig.defaults(), policy, zone);
        }
    }
}
