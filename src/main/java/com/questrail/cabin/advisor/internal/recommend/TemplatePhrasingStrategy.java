package com.questrail.cabin.advisor.internal.recommend;

import com.questrail.cabin.api.VehicleAction;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Default {@link PhrasingStrategy}: greeting + suggestion drawn from
 * {@link PhraseTemplates} by a {@link TemplateChooser}.
 */
public final class TemplatePhrasingStrategy implements PhrasingStrategy
{
    private final TemplateChooser chooser;

    public TemplatePhrasingStrategy(TemplateChooser chooser) {
        this.chooser = Objects.requireNonNull(chooser, "chooser");
    }

    public static TemplatePhrasingStrategy randomized() {
        return new TemplatePhrasingStrategy(TemplateChooser.random(new Random()));
    }

    @Override
    public String phrase(VehicleAction action, Integer value) {
        Objects.requireNonNull(action, "action");

        String standalone = PhraseTemplates.STANDALONE.get(action);
        if (standalone != null) {
            return standalone;
        }

        List<String> suggestions = PhraseTemplates.SUGGESTIONS.get(action);
        if (suggestions == null) {
            throw new IllegalArgumentException("No suggestion template for " + action.wireName());
        }
        String greeting = pick(PhraseTemplates.GREETINGS);
        String suggestion = pick(suggestions);

        if (value != null) {
            suggestion = suggestion.replace("{value}", String.valueOf(value));
        }
        return greeting + " " + suggestion;
    }

    @Override
    public String breakReminder() {
        return pick(PhraseTemplates.BREAK_REMINDERS);
    }

    private String pick(List<String> pool) {
        int index = chooser.choose(pool.size());
        if (index < 0 || index >= pool.size()) {
            throw new IllegalStateException("TemplateChooser returned " + index + " for pool of " + pool.size());
        }
        return pool.get(index);
    }
}
