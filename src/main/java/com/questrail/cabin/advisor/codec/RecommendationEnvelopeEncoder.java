package com.questrail.cabin.advisor.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.cabin.api.Recommendation;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * Encodes a recommendation batch into the {@code vehicle/recommendations}
 * JSON envelope. The timestamp is written as an ISO-8601 local date-time with
 * its offset.
 */
public final class RecommendationEnvelopeEncoder
{
    private final ObjectMapper objectMapper;

    public RecommendationEnvelopeEncoder() {
        this(new ObjectMapper());
    }

    public RecommendationEnvelopeEncoder(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public RecommendationEnvelope envelope(List<Recommendation> recommendations, ZonedDateTime timestamp) {
        Objects.requireNonNull(recommendations, "recommendations");
        Objects.requireNonNull(timestamp, "timestamp");
        return new RecommendationEnvelope(
                RecommendationEnvelope.TYPE,
                recommendations.stream().map(RecommendationEnvelope.Item::from).toList(),
                DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(timestamp));
    }

    public byte[] encode(List<Recommendation> recommendations, ZonedDateTime timestamp) {
        try {
            return objectMapper.writeValueAsBytes(envelope(recommendations, timestamp));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode recommendation envelope", e);
        }
    }
}
