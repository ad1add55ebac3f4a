package com.phillippitts.autoremediation.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted circuit breaker record; one per service.
 */
public record CircuitBreakerState(
        String service,
        BreakerState state,
        int failureCount,
        int successCount,
        Instant lastFailureAt,
        Instant openedAt,
        Instant lastSuccessAt
) {
    public CircuitBreakerState {
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(state, "state");
    }

    /** Initial state for a service that has never been remediated. */
    public static CircuitBreakerState closed(String service) {
        return new CircuitBreakerState(service, BreakerState.CLOSED, 0, 0, null, null, null);
    }

    public CircuitBreakerState toHalfOpen() {
        return new CircuitBreakerState(service, BreakerState.HALF_OPEN, failureCount, 0, lastFailureAt, openedAt,
                lastSuccessAt);
    }
}
