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
 * CRITICAL finding when the service is unreachable or answers with a 5xx status.
 */
@Component
public class HealthCheckDetector implements Detector {

    @Override
    public FindingKind kind() {
        return FindingKind.HEALTH_CHECK_FAILED;
    }

    @Override
    public Optional<Finding> evaluate(MetricsSnapshot snapshot,
                                      List<MetricsSnapshot> history,
                                      RemediationSettings.Thresholds thresholds) {
        Map<String, Object> evidence = new LinkedHashMap<>();
        if (!snapshot.reachable()) {
            evidence.put("reason", "health_endpoint_unreachable");
            evidence.put("message", snapshot.unreachableReason() == null
                    ? "Failed to connect to health endpoint"
                    : snapshot.unreachableReason());
        } else if (snapshot.serverError()) {
            evidence.put("reason", "server_error");
            evidence.put("status_code", snapshot.statusCode());
        } else {
            return Optional.empty();
        }
        return Optional.of(new Finding(snapshot.service(), kind(), Severity.CRITICAL, evidence,
                snapshot.observedAt()));
    }
}
