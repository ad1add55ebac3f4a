package com.phillippitts.autoremediation.service.detect;

import com.phillippitts.autoremediation.domain.Finding;
import com.phillippitts.autoremediation.domain.MetricsSnapshot;
import com.phillippitts.autoremediation.domain.Severity;
import com.phillippitts.autoremediation.testutil.Snapshots;
import com.phillippitts.autoremediation.testutil.TestSettings;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MemoryLeakDetectorTest {

    private final MemoryLeakDetector detector = new MemoryLeakDetector();

    private static MetricsSnapshot mem(double mb) {
        return Snapshots.healthy().memory(mb).build();
    }

    @Test
    void shouldWarnWhenAboveThresholdButNotGrowing() {
        assertThat(detector.evaluate(mem(1100), List.of(mem(1200), mem(1150), mem(1100)),
                TestSettings.thresholds()))
                .hasValueSatisfying(f -> {
                    assertThat(f.severity()).isEqualTo(Severity.WARNING);
                    assertThat(f.evidence()).containsEntry("growing", false);
                });
    }

    @Test
    void shouldBeCriticalWhenStrictlyGrowingAcrossWindow() {
        assertThat(detector.evaluate(mem(1300), List.of(mem(900), mem(1000), mem(1100), mem(1200)),
                TestSettings.thresholds()))
                .map(Finding::severity).contains(Severity.CRITICAL);
    }

    @Test
    void shouldNotTreatShortHistoryAsGrowth() {
        assertThat(detector.evaluate(mem(1300), List.of(mem(1200)), TestSettings.thresholds()))
                .map(Finding::severity).contains(Severity.WARNING);
    }

    @Test
    void shouldIgnoreMemoryBelowThreshold() {
        assertThat(detector.evaluate(mem(1000), List.of(mem(500), mem(600), mem(700)), TestSettings.thresholds()))
                .isEmpty();
    }
}
