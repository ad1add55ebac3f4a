package com.phillippitts.autoremediation.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IncidentTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private static Finding finding(Severity severity, Map<String, Object> evidence) {
        return new Finding("ar_app", FindingKind.CPU_SPIKE, severity, evidence, T0);
    }

    @Test
    void shouldOpenActiveIncidentFromFinding() {
        Incident incident = Incident.open(finding(Severity.WARNING, Map.of("cpu_usage_percent", 85.0)), T0);

        assertThat(incident.isActive()).isTrue();
        assertThat(incident.uuid()).isNotNull();
        assertThat(incident.details()).containsEntry("cpu_usage_percent", 85.0);
        assertThat(incident.createdAt()).isEqualTo(T0);
    }

    @Test
    void shouldOnlyRaiseSeverityOnMerge() {
        Incident incident = Incident.open(finding(Severity.CRITICAL, Map.of("cpu_usage_percent", 99.0)), T0);

        Incident merged = incident.merge(finding(Severity.WARNING, Map.of("cpu_usage_percent", 85.0)),
                T0.plusSeconds(5));

        assertThat(merged.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(merged.details()).containsEntry("cpu_usage_percent", 85.0);
        assertThat(merged.updatedAt()).isEqualTo(T0.plusSeconds(5));
        assertThat(merged.createdAt()).isEqualTo(T0);
    }

    @Test
    void shouldRecordResolutionDuration() {
        Incident resolved = Incident.open(finding(Severity.WARNING, Map.of()), T0).resolve(T0.plusSeconds(42));

        assertThat(resolved.status()).isEqualTo(IncidentStatus.RESOLVED);
        assertThat(resolved.resolutionDuration()).isEqualTo(Duration.ofSeconds(42));
        assertThat(resolved.isActive()).isFalse();
    }

    @Test
    void shouldRecordEscalationReason() {
        Incident escalated = Incident.open(finding(Severity.WARNING, Map.of()), T0)
                .escalate("rate limit reached", T0.plusSeconds(1));

        assertThat(escalated.status()).isEqualTo(IncidentStatus.ESCALATED);
        assertThat(escalated.escalatedAt()).isEqualTo(T0.plusSeconds(1));
        assertThat(escalated.escalationReason()).isEqualTo("rate limit reached");
    }
}
