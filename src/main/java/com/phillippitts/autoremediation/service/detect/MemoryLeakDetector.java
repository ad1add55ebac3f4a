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
 * Memory above {@code memoryMb} is a WARNING. It is CRITICAL when memory grew strictly across
 * the last {@code memoryGrowthTicks} readings, the current one included.
 */
@Component
public class MemoryLeakDetector implements Detector {

    @Override
    public FindingKind kind() {
        return FindingKind.MEMORY_LEAK;
    }

    @Override
    public Optional<Finding> evaluate(MetricsSnapshot snapshot,
                                      List<MetricsSnapshot> history,
                                      RemediationSettings.Thresholds thresholds) {
        if (!snapshot.reachable() || snapshot.memoryMb() <= thresholds.memoryMb()) {
            return Optional.empty();
        }
        boolean growing = growing(snapshot, history, thresholds.memoryGrowthTicks());
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("memory_usage_mb", snapshot.memoryMb());
        evidence.put("threshold", thresholds.memoryMb());
        evidence.put("growing", growing);
        return Optional.of(new Finding(snapshot.service(), kind(),
                growing ? Severity.CRITICAL : Severity.WARNING, evidence, snapshot.observedAt()));
    }

    private static boolean growing(MetricsSnapshot current, List<MetricsSnapshot> history, int ticks) {
        int previousNeeded = ticks - 1;
        if (history.size() < previousNeeded) {
            return false;
        }
        double next = current.memoryMb();
        for (int i = history.size() - 1; i >= history.size() - previousNeeded; i--) {
            MetricsSnapshot previous = history.get(i);
            if (!previous.reachable() || previous.memoryMb() >= next) {
                return false;
            }
            next = previous.memoryMb();
        }
        return true;
    }
}
