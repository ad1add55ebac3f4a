package com.phillippitts.autoremediation.service.detect;

import com.phillippitts.autoremediation.domain.Finding;
import com.phillippitts.autoremediation.domain.MetricsSnapshot;
import com.phillippitts.autoremediation.domain.Severity;
import com.phillippitts.autoremediation.testutil.Snapshots;
import com.phillippitts.autoremediation.testutil.TestSettings;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class CpuSpikeDetectorTest {

    private final CpuSpikeDetector detector = new CpuSpikeDetector();

    private static MetricsSnapshot cpu(double value) {
        return Snapshots.healthy().cpu(value).build();
    }

    @Test
    void shouldWarnOnFirstBreach() {
        Optional<Finding> finding = detector.evaluate(cpu(85), List.of(cpu(40)), TestSettings.thresholds());

        assertThat(finding).hasValueSatisfying(f -> {
            assertThat(f.severity()).isEqualTo(Severity.WARNING);
            assertThat(f.evidence()).containsEntry("consecutive_ticks", 1);
        });
    }

    @Test
    void shouldBecomeCriticalWhenBreachIsSustained() {
        Optional<Finding> finding = detector.evaluate(cpu(85), List.of(cpu(40), cpu(82), cpu(90)),
                TestSettings.thresholds());

        assertThat(finding).hasValueSatisfying(f -> {
            assertThat(f.severity()).isEqualTo(Severity.CRITICAL);
            assertThat(f.evidence()).containsEntry("consecutive_ticks", 3);
        });
    }

    @Test
    void shouldBecomeCriticalOnLargeSpike() {
        assertThat(detector.evaluate(cpu(97), List.of(), TestSettings.thresholds()))
                .map(Finding::severity).contains(Severity.CRITICAL);
    }

    @Test
    void shouldResetStreakAfterUnreachableReading() {
        Optional<Finding> finding = detector.evaluate(cpu(85),
                List.of(cpu(90), Snapshots.unreachable("timeout"), cpu(85)), TestSettings.thresholds());

        assertThat(finding).hasValueSatisfying(f -> assertThat(f.evidence()).containsEntry("consecutive_ticks", 2));
    }

    @Test
    void shouldIgnoreCpuAtOrBelowThreshold() {
        assertThat(detector.evaluate(cpu(80), List.of(), TestSettings.thresholds())).isEmpty();
    }
}
