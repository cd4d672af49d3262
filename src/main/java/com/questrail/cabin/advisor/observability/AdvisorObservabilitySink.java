package com.questrail.cabin.advisor.observability;

/**
 * Receives advisor session observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks are invoked from the session coordinator's loop thread and must
 * not block.</p>
 */
public interface AdvisorObservabilitySink {
    /**
     * Called when the session moves to a new phase.
     */
    void onPhaseTransition(PhaseTransitionEvent event);

    /**
     * Called after an inbound action has been applied to the session.
     */
    void onActionApplied(ActionAppliedEvent event);

    /**
     * Called after recommendations (including a break reminder) were handed to the bus.
     */
    void onRecommendationPublished(RecommendationPublishedEvent event);

    /**
     * Called for periodic status reports and for the final session summary.
     */
    void onStatus(SessionStatusEvent event);

    /**
     * Called when an error is contained by the session (publish failure,
     * unexpected processing error).
     */
    void onError(AdvisorErrorEvent event);
}
