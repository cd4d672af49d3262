package com.questrail.cabin.advisor.internal.time;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * WallClock
 * =============================================================================
 * Calendar time in the vehicle's local zone.
 *
 * <p>
 * Used for the timestamps written into published payloads, for defaulting the
 * timestamp of inbound actions that carry none, and for the time-of-day
 * lighting rule. It MUST NOT drive timers or cooldowns.
 * </p>
 */
public interface WallClock
{
    Instant now();

    ZoneId zone();

    default ZonedDateTime localNow()
    {
        return now().atZone(zone());
    }
}
