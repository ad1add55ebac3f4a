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
 * CPU above {@code cpuPercent} is a WARNING. It is CRITICAL above 1.2 times the threshold, or
 * when the breach has lasted {@code cpuSustainedTicks} consecutive ticks including this one.
 */
@Component
public class CpuSpikeDetector implements Detector {

    static final double CRITICAL_FACTOR = 1.2;

    @Override
    public FindingKind kind() {
        return FindingKind.CPU_SPIKE;
    }

    @Override
    public Optional<Finding> evaluate(MetricsSnapshot snapshot,
                                      List<MetricsSnapshot> history,
                                      RemediationSettings.Thresholds thresholds) {
        double threshold = thresholds.cpuPercent();
        if (!snapshot.reachable() || snapshot.cpuPercent() <= threshold) {
            return Optional.empty();
        }
        int streak = breachStreak(snapshot, history, threshold);
        boolean sustained = streak >= thresholds.cpuSustainedTicks();
        boolean spike = snapshot.cpuPercent() > threshold * CRITICAL_FACTOR;
        Severity severity = sustained || spike ? Severity.CRITICAL : Severity.WARNING;

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("cpu_usage_percent", snapshot.cpuPercent());
        evidence.put("threshold", threshold);
        evidence.put("consecutive_ticks", streak);
        return Optional.of(new Finding(snapshot.service(), kind(), severity, evidence, snapshot.observedAt()));
    }

    /** Number of consecutive breaching readings ending with {@code current}. */
    private static int breachStreak(MetricsSnapshot current, List<MetricsSnapshot> history, double threshold) {
        int streak = 1;
        for (int i = history.size() - 1; i >= 0; i--) {
            MetricsSnapshot previous = history.get(i);
            if (!previous.reachable() || previous.cpuPercent() <= threshold) {
                break;
            }
            streak++;
        }
        return streak;
    }
}
