package com.questrail.cabin.advisor.observability;

import com.questrail.cabin.api.Recommendation;

import java.time.Instant;
import java.util.List;

/**
 * Record representing a batch handed to the bus.
 *
 * @param sequence      1-based count of recommendation batches in this session;
 *                      {@code 0} for the break reminder, which is not counted
 * @param breakReminder whether this batch is the break reminder
 */
public record RecommendationPublishedEvent(
    Instant timestamp,
    int sequence,
    List<Recommendation> recommendations,
    boolean breakReminder
) {
    public RecommendationPublishedEvent {
        recommendations = List.copyOf(recommendations);
    }
}
