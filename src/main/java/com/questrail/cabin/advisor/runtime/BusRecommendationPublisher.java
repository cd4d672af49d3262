package com.questrail.cabin.advisor.runtime;

import com.questrail.cabin.advisor.codec.RecommendationEnvelopeEncoder;
import com.questrail.cabin.advisor.internal.exec.RecommendationPublisher;
import com.questrail.cabin.advisor.transport.BusEndpoint;
import com.questrail.cabin.api.Recommendation;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Outbound path: recommendation batch, then JSON envelope, then bus topic.
 *
 * <pre>
 *   SessionCoordinator
 *        → BusRecommendationPublisher.publish(...)
 *            → RecommendationEnvelopeEncoder
 *                → BusEndpoint
 * </pre>
 */
public final class BusRecommendationPublisher implements RecommendationPublisher
{
    private final BusEndpoint endpoint;
    private final RecommendationEnvelopeEncoder encoder;
    private final String topic;

    public BusRecommendationPublisher(BusEndpoint endpoint, RecommendationEnvelopeEncoder encoder, String topic) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.topic = Objects.requireNonNull(topic, "topic");
    }

    @Override
    public void publish(List<Recommendation> recommendations, ZonedDateTime timestamp) {
        endpoint.publish(topic, encoder.encode(recommendations, timestamp));
    }
}
