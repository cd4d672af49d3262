package com.questrail.cabin.advisor.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * AdvisorEvent
 * -----------------------------------------------------------------------------
 * Marker interface for everything the session coordinator processes.
 *
 * <h2>Role in the architecture</h2>
 * The advisor is an actor-style, single-writer system. The bus handler and
 * every timer callback communicate with the session only by posting one of
 * these events; the coordinator applies them one at a time on its own loop.
 * That covers:
 * <ul>
 *   <li>driver actions decoded from the bus ({@link ActionReceived})</li>
 *   <li>timer expiries ({@link SessionTimerEvent})</li>
 * </ul>
 *
 * Events are immutable and carry only what is needed to advance the session.
 */
public interface AdvisorEvent
{
    /**
     * Wall-clock time at which the event was generated. Observational only.
     */
    Instant timestamp();

    /**
     * Convenience base class for simple events.
     */
    abstract class Base implements AdvisorEvent {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }
    }
}
