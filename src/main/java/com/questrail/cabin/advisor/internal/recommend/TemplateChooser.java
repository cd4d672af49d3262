package com.questrail.cabin.advisor.internal.recommend;

import java.util.Objects;
import java.util.Random;

/**
 * Picks one template out of a pool of {@code size} alternatives.
 */
@FunctionalInterface
public interface TemplateChooser
{
    /**
     * @param size number of alternatives, always &gt; 0
     * @return index in {@code [0, size)}
     */
    int choose(int size);

    static TemplateChooser random(Random random) {
        Objects.requireNonNull(random, "random");
        return random::nextInt;
    }

    /** Always picks the first alternative. */
    static TemplateChooser first() {
        return size -> 0;
    }
}
