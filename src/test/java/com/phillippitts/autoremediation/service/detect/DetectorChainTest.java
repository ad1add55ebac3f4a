package com.phillippitts.autoremediation.service.detect;

import com.phillippitts.autoremediation.domain.Finding;
import com.phillippitts.autoremediation.domain.FindingKind;
import com.phillippitts.autoremediation.domain.MetricsSnapshot;
import com.phillippitts.autoremediation.domain.RemediationSettings;
import com.phillippitts.autoremediation.testutil.Snapshots;
import com.phillippitts.autoremediation.testutil.TestSettings;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class DetectorChainTest {

    private static final Detector BROKEN = new Detector() {
        @Override
        public FindingKind kind() {
            return FindingKind.CPU_SPIKE;
        }

        @Override
        public Optional<Finding> evaluate(MetricsSnapshot snapshot,
                                          List<MetricsSnapshot> history,
                                          RemediationSettings.Thresholds thresholds) {
            throw new IllegalStateException("boom");
        }
    };

    @Test
    void shouldCollectFindingsFromAllDetectors() {
        DetectorChain chain = new DetectorChain(List.of(new HealthCheckDetector(), new ErrorRateDetector(),
                new CpuSpikeDetector(), new ResponseTimeDetector(), new MemoryLeakDetector()));
        MetricsSnapshot bad = Snapshots.healthy().status(500).cpu(90).requests(10, 5).build();

        List<Finding> findings = chain.evaluate(bad, List.of(), TestSettings.thresholds());

        assertThat(findings).extracting(Finding::kind).containsExactly(
                FindingKind.HEALTH_CHECK_FAILED, FindingKind.HIGH_ERROR_RATE, FindingKind.CPU_SPIKE);
    }

    @Test
    void shouldKeepGoingWhenOneDetectorThrows() {
        DetectorChain chain = new DetectorChain(List.of(BROKEN, new HealthCheckDetector()));

        List<Finding> findings = chain.evaluate(Snapshots.unreachable("refused"), List.of(),
                TestSettings.thresholds());

        assertThat(findings).extracting(Finding::kind).containsExactly(FindingKind.HEALTH_CHECK_FAILED);
    }

    @Test
    void shouldReturnNothingForHealthySnapshot() {
        DetectorChain chain = new DetectorChain(List.of(new HealthCheckDetector(), new ErrorRateDetector()));

        assertThat(chain.evaluate(Snapshots.healthy().build(), List.of(), TestSettings.thresholds())).isEmpty();
    }
}
