package com.questrail.cabin.advisor.internal.recommend;

import com.questrail.cabin.api.Recommendation;

import java.util.List;

/**
 * Produces the suggestions for one recommendation cycle.
 *
 * <p>The session coordinator treats an empty list as "nothing to publish".
 * The rule engine ({@link RuleBasedRecommendationGenerator}) is the shipped
 * implementation; a trained model could be plugged in behind this interface.</p>
 */
@FunctionalInterface
public interface RecommendationGenerator
{
    List<Recommendation> generate(RecommendationContext context);
}
