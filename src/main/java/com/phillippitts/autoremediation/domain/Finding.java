package com.phillippitts.autoremediation.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single detector's momentary judgment that a threshold is breached.
 *
 * <p>Findings are produced every tick and handed straight to the incident manager; they are
 * never stored on their own.
 */
public record Finding(
        String service,
        FindingKind kind,
        Severity severity,
        Map<String, Object> evidence,
        Instant observedAt
) {
    public Finding {
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(observedAt, "observedAt");
        evidence = evidence == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
    }
}
