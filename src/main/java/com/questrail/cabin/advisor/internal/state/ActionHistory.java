package com.questrail.cabin.advisor.internal.state;

import com.questrail.cabin.api.ActionEvent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * ActionHistory
 * -----------------------------------------------------------------------------
 * Bounded, time-ordered record of the most recent actions.
 *
 * <p>Append-only: the oldest entry is evicted once capacity is reached and
 * there is no other way to remove entries. Not thread-safe; the session
 * coordinator is its only writer and reads it under its state lock.</p>
 */
public final class ActionHistory
{
    public static final int DEFAULT_CAPACITY = 50;

    private final int capacity;
    private final Deque<ActionEvent> events;

    public ActionHistory() {
        this(DEFAULT_CAPACITY);
    }

    public ActionHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.events = new ArrayDeque<>(capacity);
    }

    public void append(ActionEvent event) {
        Objects.requireNonNull(event, "event");
        if (events.size() == capacity) {
            events.removeFirst();
        }
        events.addLast(event);
    }

    /**
     * Returns the names of the last {@code n} actions, oldest first.
     */
    public List<String> recentWindow(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0");
        }
        int skip = Math.max(0, events.size() - n);
        List<String> window = new ArrayList<>(Math.min(n, events.size()));
        int index = 0;
        for (ActionEvent e : events) {
            if (index++ >= skip) {
                window.add(e.action());
            }
        }
        return List.copyOf(window);
    }

    /**
     * Returns the full history, oldest first.
     */
    public List<ActionEvent> events() {
        return List.copyOf(events);
    }

    public int size() {
        return events.size();
    }

    public int capacity() {
        return capacity;
    }
}
