package com.questrail.cabin.advisor.observability;

/**
 * No-op implementation of AdvisorObservabilitySink.
 */
public final class NullObservabilitySink implements AdvisorObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onPhaseTransition(PhaseTransitionEvent event) {}

    @Override
    public void onActionApplied(ActionAppliedEvent event) {}

    @Override
    public void onRecommendationPublished(RecommendationPublishedEvent event) {}

    @Override
    public void onStatus(SessionStatusEvent event) {}

    @Override
    public void onError(AdvisorErrorEvent event) {}
}
