package com.phillippitts.autoremediation.service.detect;

import com.phillippitts.autoremediation.domain.Finding;
import com.phillippitts.autoremediation.domain.FindingKind;
import com.phillippitts.autoremediation.domain.MetricsSnapshot;
import com.phillippitts.autoremediation.domain.RemediationSettings;
import com.phillippitts.autoremediation.domain.Severity;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * p95 latency above {@code responseTimeMs} is a WARNING, above twice the threshold CRITICAL.
 * Snapshots without a p95 value produce nothing.
 */
@Component
public class ResponseTimeDetector implements Detector {

    static final double CRITICAL_FACTOR = 2.0;

    @Override
    public FindingKind kind() {
        return FindingKind.HIGH_RESPONSE_TIME;
    }

    @Override
    public Optional<Finding> evaluate(MetricsSnapshot snapshot,
                                      List<MetricsSnapshot> history,
                                      RemediationSettings.Thresholds thresholds) {
        Double p95 = snapshot.p95Ms();
        double threshold = thresholds.responseTimeMs();
        if (!snapshot.reachable() || p95 == null || p95 <= threshold) {
            return Optional.empty();
        }
        Severity severity = p95 > threshold * CRITICAL_FACTOR ? Severity.CRITICAL : Severity.WARNING;
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("p95_response_time_ms", p95);
        evidence.put("threshold", threshold);
        if (snapshot.p50Ms() != null) {
            evidence.put("p50_ms", snapshot.p50Ms());
        }
        if (snapshot.p99Ms() != null) {
            evidence.put("p99_ms", snapshot.p99Ms());
        }
        return Optional.of(new Finding(snapshot.service(), kind(), severity, evidence, snapshot.observedAt()));
    }
}
