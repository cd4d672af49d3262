package com.questrail.cabin.advisor.observability;

import com.questrail.cabin.api.Recommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of AdvisorObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jAdvisorObservabilitySink implements AdvisorObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jAdvisorObservabilitySink.class);

    @Override
    public void onPhaseTransition(PhaseTransitionEvent event) {
        log.info("Session phase: {} -> {}{}",
            event.oldPhase(),
            event.newPhase(),
            event.early() ? " (completed early)" : "");
    }

    @Override
    public void onActionApplied(ActionAppliedEvent event) {
        if (!event.known()) {
            log.info("Action: {} (unknown, recorded only)", event.action().action());
        } else if (event.action().value() != null) {
            log.info("Action: {} ({})", event.action().action(), event.action().value());
        } else {
            log.info("Action: {}", event.action().action());
        }
        log.debug("Car state after {}: {}", event.action().action(), event.carState());
    }

    @Override
    public void onRecommendationPublished(RecommendationPublishedEvent event) {
        if (event.breakReminder()) {
            log.info("Break reminder sent");
        } else {
            log.info("Recommendation #{} sent", event.sequence());
        }
        for (Recommendation r : event.recommendations()) {
            log.info("  - [{}] {}", r.action(), r.message());
        }
    }

    @Override
    public void onStatus(SessionStatusEvent event) {
        if (event.finalReport()) {
            log.info("Session summary: duration={}s, actions processed={}, recommendations sent={}, learned preferences={}",
                event.sessionDuration().toSeconds(),
                event.actionsProcessed(),
                event.recommendationsSent(),
                event.learnedPreferences());
        } else {
            log.info("Status: {} | Duration: {}s | Actions: {} | Recommendations: {}",
                event.phase(),
                event.sessionDuration().toSeconds(),
                event.actionsProcessed(),
                event.recommendationsSent());
        }
    }

    @Override
    public void onError(AdvisorErrorEvent event) {
        log.error("Advisor error: {}", event.message(), event.cause());
    }
}
