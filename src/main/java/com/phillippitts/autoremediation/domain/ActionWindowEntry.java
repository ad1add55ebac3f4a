package com.phillippitts.autoremediation.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One counted remediation attempt in the rate limiter's sliding window.
 */
public record ActionWindowEntry(
        String service,
        ActionType actionType,
        Instant timestamp,
        boolean success
) {
    public ActionWindowEntry {
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(actionType, "actionType");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
