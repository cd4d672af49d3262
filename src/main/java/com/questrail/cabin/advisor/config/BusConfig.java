package com.questrail.cabin.advisor.config;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Message bus connection settings.
 *
 * @param host                 broker host name
 * @param port                 broker TCP port
 * @param clientId             MQTT client identifier
 * @param keepAlive            MQTT keep-alive; a PINGREQ is sent when the connection is idle this long
 * @param actionsTopic         inbound topic carrying driver actions
 * @param recommendationsTopic outbound topic for recommendation batches and break reminders
 * @param connectAttempts      attempts made before startup fails
 * @param connectBackoff       pause between attempts
 * @param connectTimeout       limit for one attempt, TCP connect and MQTT handshake each
 */
public record BusConfig(
    String host,
    int port,
    String clientId,
    Duration keepAlive,
    String actionsTopic,
    String recommendationsTopic,
    int connectAttempts,
    Duration connectBackoff,
    Duration connectTimeout
) {
    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 1883;
    public static final String ACTIONS_TOPIC = "vehicle/actions";
    public static final String RECOMMENDATIONS_TOPIC = "vehicle/recommendations";

    public static final String ENV_HOST = "MQTT_HOST";
    public static final String ENV_PORT = "MQTT_PORT";
    public static final String ENV_CLIENT_ID = "MQTT_CLIENT_ID";

    public BusConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(keepAlive, "keepAlive");
        Objects.requireNonNull(actionsTopic, "actionsTopic");
        Objects.requireNonNull(recommendationsTopic, "recommendationsTopic");
        Objects.requireNonNull(connectBackoff, "connectBackoff");
        Objects.requireNonNull(connectTimeout, "connectTimeout");

        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (clientId.isBlank()) {
            throw new IllegalArgumentException("clientId must not be blank");
        }
        if (keepAlive.isNegative() || keepAlive.toSeconds() > 0xFFFF) {
            throw new IllegalArgumentException("keepAlive must be between 0 and 65535 seconds");
        }
        if (connectAttempts <= 0) {
            throw new IllegalArgumentException("connectAttempts must be positive");
        }
        if (connectBackoff.isNegative()) {
            throw new IllegalArgumentException("connectBackoff must be non-negative");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
    }

    public static BusConfig defaults() {
        return builder().build();
    }

    /**
     * Reads {@value #ENV_HOST}, {@value #ENV_PORT} and {@value #ENV_CLIENT_ID};
     * anything absent or blank keeps its default.
     *
     * @throws IllegalArgumentException if a present value cannot be used
     */
    public static BusConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        Builder b = builder();
        EnvironmentValues.string(env, ENV_HOST).ifPresent(b::withHost);
        EnvironmentValues.integer(env, ENV_PORT).ifPresent(b::withPort);
        EnvironmentValues.string(env, ENV_CLIENT_ID).ifPresent(b::withClientId);
        return b.build();
    }

    static String randomClientId() {
        return "cabin-advisor-" + ThreadLocalRandom.current().nextInt(1000, 10000);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private String clientId;
        private Duration keepAlive = Duration.ofSeconds(60);
        private String actionsTopic = ACTIONS_TOPIC;
        private String recommendationsTopic = RECOMMENDATIONS_TOPIC;
        private int connectAttempts = 10;
        private Duration connectBackoff = Duration.ofSeconds(5);
        private Duration connectTimeout = Duration.ofSeconds(10);

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withClientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder withKeepAlive(Duration keepAlive) {
            this.keepAlive = keepAlive;
            return this;
        }

        public Builder withActionsTopic(String topic) {
            this.actionsTopic = topic;
            return this;
        }

        public Builder withRecommendationsTopic(String topic) {
            this.recommendationsTopic = topic;
            return this;
        }

        public Builder withConnectAttempts(int attempts) {
            this.connectAttempts = attempts;
            return this;
        }

        public Builder withConnectBackoff(Duration backoff) {
            this.connectBackoff = backoff;
            return this;
        }

        public Builder withConnectTimeout(Duration timeout) {
            this.connectTimeout = timeout;
            return this;
        }

        public BusConfig build() {
            return new BusConfig(host, port, clientId != null ? clientId : randomClientId(), keepAlive,
                    actionsTopic, recommendationsTopic, connectAttempts, connectBackoff, connectTimeout);
        }
    }
}
