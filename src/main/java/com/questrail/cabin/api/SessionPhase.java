package com.questrail.cabin.api;

/**
 * Lifecycle phase of an advisor session.
 */
public enum SessionPhase
{
    /** No action received yet. */
    IDLE,

    /** Observing actions; no recommendations yet. */
    LEARNING,

    /** Recommendation loop running. Terminal. */
    ACTIVE
}
