package com.questrail.cabin.advisor.config;

import com.questrail.cabin.advisor.internal.exec.AdvisorPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AdvisorRuntimeConfigTest {

    @Test
    void emptyEnvironmentGivesDefaults() {
        AdvisorRuntimeConfig c = AdvisorRuntimeConfig.fromEnvironment(Map.of());

        assertEquals(AdvisorPolicy.defaults(), c.policy());
        assertEquals(ZoneId.systemDefault(), c.zone());
        assertEquals(1883, c.bus().port());
    }

    @Test
    void policyOverridesAreSeconds() {
        AdvisorRuntimeConfig c = AdvisorRuntimeConfig.fromEnvironment(Map.of(
                "ADVISOR_LEARNING_PERIOD_SECONDS", "5",
                "ADVISOR_RECOMMENDATION_INTERVAL_SECONDS", "2",
                "ADVISOR_BREAK_REMINDER_SECONDS", "60",
                "ADVISOR_MAX_RECOMMENDATIONS", "3",
                "ADVISOR_ZONE", "Europe/Berlin"));

        assertEquals(Duration.ofSeconds(5), c.policy().learningPeriod());
        assertEquals(Duration.ofSeconds(2), c.policy().recommendationInterval());
        assertEquals(Duration.ofSeconds(60), c.policy().breakReminderDelay());
        assertEquals(3, c.policy().maxRecommendationsPerSession());
        assertEquals(AdvisorPolicy.defaults().historyCapacity(), c.policy().historyCapacity());
        assertEquals(ZoneId.of("Europe/Berlin"), c.zone());
    }

    @Test
    void bogusZoneIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> AdvisorRuntimeConfig.fromEnvironment(Map.of("ADVISOR_ZONE", "Mars/Olympus")));
    }

    @Test
    void zeroIntervalIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> AdvisorRuntimeConfig.fromEnvironment(Map.of("ADVISOR_RECOMMENDATION_INTERVAL_SECONDS", "0")));
    }

    @Test
    void builderFallsBackToDefaultBus() {
        AdvisorRuntimeConfig c = AdvisorRuntimeConfig.builder().withZone(ZoneId.of("UTC")).build();

        assertEquals("localhost", c.bus().host());
        assertEquals(ZoneId.of("UTC"), c.zone());
    }
}
