package com.phillippitts.autoremediation.service.breaker;

import com.phillippitts.autoremediation.domain.BreakerState;

/**
 * Result of {@link CircuitBreaker#allow}. The breaker never throws to its caller; every outcome
 * is one of these values.
 *
 * @param verdict what the caller may do
 * @param state breaker state observed while deciding; {@code null} when the store was unavailable
 * @param reason short explanation for logs and escalation messages
 */
public record BreakerDecision(Verdict verdict, BreakerState state, String reason) {

    public enum Verdict {
        /** Attempt may proceed; the caller now holds the in-flight slot and must release it. */
        ALLOWED,
        /** Breaker is OPEN and still cooling down. */
        OPEN,
        /** Another attempt for the service is in flight. */
        BUSY,
        /** Breaker state could not be read or written. */
        UNAVAILABLE
    }

    static BreakerDecision allowed(BreakerState state) {
        return new BreakerDecision(Verdict.ALLOWED, state, "allowed");
    }

    static BreakerDecision open(String reason) {
        return new BreakerDecision(Verdict.OPEN, BreakerState.OPEN, reason);
    }

    static BreakerDecision busy(BreakerState state) {
        return new BreakerDecision(Verdict.BUSY, state, "remediation already in flight");
    }

    static BreakerDecision unavailable(String reason) {
        return new BreakerDecision(Verdict.UNAVAILABLE, null, reason);
    }

    public boolean isAllowed() {
        return verdict == Verdict.ALLOWED;
    }
}
