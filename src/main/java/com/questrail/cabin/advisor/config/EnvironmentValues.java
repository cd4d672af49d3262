package com.questrail.cabin.advisor.config;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;
import java.util.Optional;

/**
 * Typed lookups over an environment map. Absent and blank values are treated alike.
 */
final class EnvironmentValues
{
    private EnvironmentValues() {
    }

    static Optional<String> string(Map<String, String> env, String key) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    static Optional<Integer> integer(Map<String, String> env, String key) {
        return string(env, key).map(v -> {
            try {
                return Integer.parseInt(v);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " is not an integer: " + v, e);
            }
        });
    }

    static Optional<Duration> seconds(Map<String, String> env, String key) {
        return integer(env, key).map(Duration::ofSeconds);
    }

    static Optional<ZoneId> zone(Map<String, String> env, String key) {
        return string(env, key).map(v -> {
            try {
                return ZoneId.of(v);
            } catch (DateTimeException e) {
                throw new IllegalArgumentException(key + " is not a valid zone id: " + v, e);
            }
        });
    }
}
