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
 * Error ratio above {@code errorRate} is a WARNING, above {@code errorRateCritical} CRITICAL.
 */
@Component
public class ErrorRateDetector implements Detector {

    @Override
    public FindingKind kind() {
        return FindingKind.HIGH_ERROR_RATE;
    }

    @Override
    public Optional<Finding> evaluate(MetricsSnapshot snapshot,
                                      List<MetricsSnapshot> history,
                                      RemediationSettings.Thresholds thresholds) {
        if (!snapshot.reachable()) {
            return Optional.empty();
        }
        double rate = snapshot.effectiveErrorRate();
        if (rate <= thresholds.errorRate()) {
            return Optional.empty();
        }
        Severity severity = rate > thresholds.errorRateCritical() ? Severity.CRITICAL : Severity.WARNING;
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("error_rate", rate);
        evidence.put("threshold", thresholds.errorRate());
        evidence.put("total_requests", snapshot.requests());
        evidence.put("total_errors", snapshot.errors());
        return Optional.of(new Finding(snapshot.service(), kind(), severity, evidence, snapshot.observedAt()));
    }
}
