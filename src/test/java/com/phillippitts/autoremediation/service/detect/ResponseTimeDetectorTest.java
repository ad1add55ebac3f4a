package com.phillippitts.autoremediation.service.detect;

import com.phillippitts.autoremediation.domain.Finding;
import com.phillippitts.autoremediation.domain.Severity;
import com.phillippitts.autoremediation.testutil.Snapshots;
import com.phillippitts.autoremediation.testutil.TestSettings;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseTimeDetectorTest {

    private final ResponseTimeDetector detector = new ResponseTimeDetector();

    @Test
    void shouldWarnWhenP95AboveThreshold() {
        Optional<Finding> finding = detector.evaluate(
                Snapshots.healthy().latency(120.0, 650.0, 900.0).build(), List.of(), TestSettings.thresholds());

        assertThat(finding).hasValueSatisfying(f -> {
            assertThat(f.severity()).isEqualTo(Severity.WARNING);
            assertThat(f.evidence()).containsEntry("p95_response_time_ms", 650.0)
                    .containsEntry("p50_ms", 120.0)
                    .containsEntry("p99_ms", 900.0);
        });
    }

    @Test
    void shouldBeCriticalAboveTwiceTheThreshold() {
        assertThat(detector.evaluate(Snapshots.healthy().latency(null, 1200.0, null).build(), List.of(),
                TestSettings.thresholds()))
                .hasValueSatisfying(f -> {
                    assertThat(f.severity()).isEqualTo(Severity.CRITICAL);
                    assertThat(f.evidence()).doesNotContainKeys("p50_ms", "p99_ms");
                });
    }

    @Test
    void shouldSkipSnapshotsWithoutLatency() {
        assertThat(detector.evaluate(Snapshots.healthy().build(), List.of(), TestSettings.thresholds())).isEmpty();
    }
}
