package com.phillippitts.autoremediation.service.breaker;

import com.phillippitts.autoremediation.domain.BreakerState;
import com.phillippitts.autoremediation.domain.CircuitBreakerState;

/**
 * Breaker state before and after an outcome was recorded.
 */
public record BreakerTransition(BreakerState from, CircuitBreakerState after) {

    /** No outcome recorded; the breaker stays as it is. */
    public static BreakerTransition unchanged(CircuitBreakerState state) {
        return new BreakerTransition(state.state(), state);
    }

    public BreakerState to() {
        return after.state();
    }

    /** True when this outcome moved the breaker to OPEN. */
    public boolean opened() {
        return from != BreakerState.OPEN && after.state() == BreakerState.OPEN;
    }

    public boolean closed() {
        return from != BreakerState.CLOSED && after.state() == BreakerState.CLOSED;
    }
}
