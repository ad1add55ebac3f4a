package com.phillippitts.autoremediation.service.remediation;

/**
 * What happened when an automatic attempt was requested for an incident.
 */
public enum AttemptOutcome {
    /** Action executed and succeeded; incident resolved. */
    SUCCEEDED,
    /** Action executed and failed. */
    FAILED,
    /** Frequency cap reached; incident escalated. */
    RATE_LIMITED,
    /** Breaker OPEN; incident escalated. */
    BREAKER_OPEN,
    /** Another attempt for the service is in flight; nothing done. */
    BUSY,
    /** Breaker state could not be read; retried next tick. */
    UNAVAILABLE
}
