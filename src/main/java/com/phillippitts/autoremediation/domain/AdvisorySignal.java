package com.phillippitts.autoremediation.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Signal from an external advisor (anomaly score, failure probability, forecast breach).
 *
 * @param source name of the producer, e.g. {@code failure-predictor}
 * @param severity severity the producer assigns; {@code null} means WARNING
 * @param message human readable summary
 * @param evidence producer specific values (probability, score, forecast horizon)
 * @param at when the producer emitted the signal; {@code null} means now
 */
public record AdvisorySignal(
        String source,
        Severity severity,
        String message,
        Map<String, Object> evidence,
        Instant at
) {
    public AdvisorySignal {
        Objects.requireNonNull(source, "source");
        if (severity == null) {
            severity = Severity.WARNING;
        }
        if (at == null) {
            at = Instant.now();
        }
        evidence = evidence == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
    }
}
