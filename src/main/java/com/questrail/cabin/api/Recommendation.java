package com.questrail.cabin.api;

import java.util.Objects;

/**
 * A suggestion published to the driver.
 *
 * @param action  the action being suggested, or {@link #TAKE_BREAK}
 * @param message human-readable phrasing
 * @param value   suggested setting for set-style actions, otherwise {@code null}
 */
public record Recommendation(String action, String message, Integer value)
{
    /** Action name carried by break reminders. */
    public static final String TAKE_BREAK = "take_break";

    public Recommendation {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(message, "message");
    }

    public static Recommendation breakReminder(String message) {
        return new Recommendation(TAKE_BREAK, message, null);
    }
}
