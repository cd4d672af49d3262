package com.questrail.cabin.advisor.internal.time;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Production {@link WallClock} backed by {@link Instant#now()} in a fixed zone.
 */
public final class SystemWallClock implements WallClock {

    private final ZoneId zone;

    public SystemWallClock(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public static SystemWallClock systemDefault() {
        return new SystemWallClock(ZoneId.systemDefault());
    }

    @Override
    public Instant now() {
        return Instant.now();
    }

    @Override
    public ZoneId zone() {
        return zone;
    }
}
