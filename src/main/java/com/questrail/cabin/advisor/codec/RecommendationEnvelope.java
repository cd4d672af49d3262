package com.questrail.cabin.advisor.codec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.questrail.cabin.api.Recommendation;

import java.util.List;

/**
 * Wire shape of one {@code vehicle/recommendations} message.
 */
public record RecommendationEnvelope(
        @JsonProperty("type") String type,
        @JsonProperty("recommendations") List<Item> recommendations,
        @JsonProperty("timestamp") String timestamp
) {
    public static final String TYPE = "ai_suggestion";

    public RecommendationEnvelope {
        recommendations = List.copyOf(recommendations);
    }

    /**
     * One recommendation; {@code value} is always written, as {@code null} when absent.
     */
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record Item(
            @JsonProperty("action") String action,
            @JsonProperty("message") String message,
            @JsonProperty("value") Integer value
    ) {
        static Item from(Recommendation recommendation) {
            return new Item(recommendation.action(), recommendation.message(), recommendation.value());
        }
    }
}
