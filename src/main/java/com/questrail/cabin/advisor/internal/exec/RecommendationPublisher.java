package com.questrail.cabin.advisor.internal.exec;

import com.questrail.cabin.api.Recommendation;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * Outbound port used by the session coordinator to emit recommendation batches.
 *
 * <p>Implementations must not block on I/O. A failure is reported by throwing;
 * the coordinator logs it and carries on with the next cycle.</p>
 */
@FunctionalInterface
public interface RecommendationPublisher
{
    void publish(List<Recommendation> recommendations, ZonedDateTime timestamp);
}
