package com.questrail.cabin.advisor.observability;

import java.time.Instant;

/**
 * Record representing an error contained by the advisor.
 */
public record AdvisorErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
