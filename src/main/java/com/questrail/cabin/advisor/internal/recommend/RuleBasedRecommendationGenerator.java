package com.questrail.cabin.advisor.internal.recommend;

import com.questrail.cabin.api.Recommendation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * RuleBasedRecommendationGenerator
 * -----------------------------------------------------------------------------
 * Walks {@link RecommendationRule} in declaration order and keeps the first
 * {@link #MAX_PER_CYCLE} eligible candidates. Later rules are not evaluated
 * once the limit is reached.
 *
 * <p>Eligibility is deterministic. Only the message text depends on the
 * injected {@link PhrasingStrategy}.</p>
 */
public final class RuleBasedRecommendationGenerator implements RecommendationGenerator
{
    public static final int MAX_PER_CYCLE = 2;

    private final PhrasingStrategy phrasing;

    public RuleBasedRecommendationGenerator(PhrasingStrategy phrasing) {
        this.phrasing = Objects.requireNonNull(phrasing, "phrasing");
    }

    @Override
    public List<Recommendation> generate(RecommendationContext context) {
        Objects.requireNonNull(context, "context");

        List<Recommendation> out = new ArrayList<>(MAX_PER_CYCLE);
        for (RecommendationRule rule : RecommendationRule.values()) {
            if (out.size() == MAX_PER_CYCLE) {
                break;
            }
            Optional<RecommendationRule.Candidate> candidate = rule.evaluate(context);
            candidate.ifPresent(c -> out.add(new Recommendation(
                    c.action().wireName(),
                    phrasing.phrase(c.action(), c.value()),
                    c.value())));
        }
        return List.copyOf(out);
    }
}
