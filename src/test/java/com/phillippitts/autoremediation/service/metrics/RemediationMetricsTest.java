package com.phillippitts.autoremediation.service.metrics;

import com.phillippitts.autoremediation.domain.ActionType;
import com.phillippitts.autoremediation.domain.BreakerState;
import com.phillippitts.autoremediation.domain.FindingKind;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RemediationMetricsTest {

    private MeterRegistry registry;
    private RemediationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RemediationMetrics(registry);
    }

    @Test
    void shouldCountDetectionsPerKind() {
        metrics.recordDetection(FindingKind.CPU_SPIKE);
        metrics.recordDetection(FindingKind.CPU_SPIKE);
        metrics.recordDetection(FindingKind.MEMORY_LEAK);

        assertThat(registry.get("remediation.detections").tag("kind", "cpu_spike").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("remediation.detections").tag("kind", "memory_leak").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldRecordActionOutcomeAndDuration() {
        metrics.recordAction(ActionType.RESTART_CONTAINER, true, Duration.ofMillis(250));
        metrics.recordAction(ActionType.RESTART_CONTAINER, false, Duration.ofMillis(750));

        assertThat(registry.get("remediation.actions").tag("outcome", "success").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("remediation.actions").tag("outcome", "failure").counter().count()).isEqualTo(1.0);
        Timer timer = registry.get("remediation.action.duration").tag("action_type", "restart_container").timer();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(1000.0);
    }

    @Test
    void shouldTrackBreakerStatePerService() {
        metrics.updateBreakerState("ar_app", BreakerState.OPEN);
        Gauge gauge = registry.get("remediation.breaker.state").tag("service", "ar_app").gauge();
        assertThat(gauge.value()).isEqualTo(2.0);

        metrics.updateBreakerState("ar_app", BreakerState.HALF_OPEN);
        assertThat(gauge.value()).isEqualTo(1.0);
        assertThat(registry.find("remediation.breaker.state").gauges()).hasSize(1);
    }

    @Test
    void shouldCountTripsAndEscalations() {
        metrics.recordBreakerTrip("ar_app");
        metrics.recordEscalation("ar_app");
        metrics.recordEscalation("ar_app");

        assertThat(registry.get("remediation.breaker.trips").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("remediation.escalations").tag("service", "ar_app").counter().count())
                .isEqualTo(2.0);
    }
}
