package com.phillippitts.autoremediation.service.remediation;

import com.phillippitts.autoremediation.domain.ActionType;
import com.phillippitts.autoremediation.domain.BreakerState;
import com.phillippitts.autoremediation.domain.Finding;
import com.phillippitts.autoremediation.domain.FindingKind;
import com.phillippitts.autoremediation.domain.Incident;
import com.phillippitts.autoremediation.domain.IncidentStatus;
import com.phillippitts.autoremediation.domain.RemediationAction;
import com.phillippitts.autoremediation.domain.RemediationSettings;
import com.phillippitts.autoremediation.domain.Severity;
import com.phillippitts.autoremediation.service.notification.NotificationEventType;
import com.phillippitts.autoremediation.testutil.RemediationFixture;
import com.phillippitts.autoremediation.testutil.ScriptedLifecycleProvider;
import com.phillippitts.autoremediation.testutil.TestSettings;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AutomaticRemediationServiceTest {

    private static final String SERVICE = TestSettings.SERVICE;

    private static Incident healthIncident(RemediationFixture f, RemediationSettings settings) {
        return f.incidents.record(new Finding(SERVICE, FindingKind.HEALTH_CHECK_FAILED, Severity.CRITICAL,
                Map.of("reason", "health_endpoint_unreachable"), f.clock.instant()), settings);
    }

    private static Incident current(RemediationFixture f, Incident incident) {
        return f.store.findIncident(incident.id()).orElseThrow();
    }

    @Test
    void shouldResolveIncidentAfterSuccessfulRestart() {
        RemediationFixture f = new RemediationFixture(ScriptedLifecycleProvider.alwaysSucceeding());
        RemediationSettings settings = TestSettings.defaults();
        Incident incident = healthIncident(f, settings);

        AttemptOutcome outcome = f.automatic.attempt(incident, settings);

        assertThat(outcome).isEqualTo(AttemptOutcome.SUCCEEDED);
        assertThat(f.provider.calls()).containsExactly("restart:ar_app");
        assertThat(current(f, incident).status()).isEqualTo(IncidentStatus.RESOLVED);
        assertThat(f.breaker.currentState(SERVICE).state()).isEqualTo(BreakerState.CLOSED);
        assertThat(f.breaker.currentState(SERVICE).failureCount()).isZero();
        assertThat(f.breaker.isInFlight(SERVICE)).isFalse();

        List<RemediationAction> actions = f.store.findActions(incident.id());
        assertThat(actions).hasSize(1);
        assertThat(actions.get(0).success()).isTrue();
        assertThat(actions.get(0).triggeredBy()).isEqualTo("bot");
        assertThat(f.publisher.types()).containsExactly(
                NotificationEventType.INCIDENT_CREATED,
                NotificationEventType.REMEDIATION_STARTED,
                NotificationEventType.REMEDIATION_SUCCEEDED,
                NotificationEventType.INCIDENT_RESOLVED);
    }

    @Test
    void shouldOpenBreakerAfterThirdFailureAndStopCallingProvider() {
        RemediationFixture f = new RemediationFixture(ScriptedLifecycleProvider.alwaysFailing());
        RemediationSettings settings = TestSettings.with(
                new RemediationSettings.Limits(10, Duration.ofSeconds(300), Duration.ofSeconds(120), 3, 1));
        Incident incident = healthIncident(f, settings);

        assertThat(f.automatic.attempt(current(f, incident), settings)).isEqualTo(AttemptOutcome.FAILED);
        f.clock.advanceSeconds(20);
        assertThat(f.automatic.attempt(current(f, incident), settings)).isEqualTo(AttemptOutcome.FAILED);
        f.clock.advanceSeconds(20);
        assertThat(f.automatic.attempt(current(f, incident), settings)).isEqualTo(AttemptOutcome.FAILED);

        assertThat(f.breaker.currentState(SERVICE).state()).isEqualTo(BreakerState.OPEN);
        Incident escalated = current(f, incident);
        assertThat(escalated.status()).isEqualTo(IncidentStatus.ESCALATED);
        assertThat(escalated.escalationReason()).contains("circuit breaker OPEN");

        Incident next = healthIncident(f, settings);
        f.clock.advanceSeconds(20);
        f.automatic.attempt(next, settings);
        f.clock.advanceSeconds(20);
        f.automatic.attempt(next, settings);

        assertThat(f.provider.restarts()).isEqualTo(3);
        assertThat(f.publisher.ofType(NotificationEventType.CIRCUIT_OPENED)).hasSize(1);
        assertThat(f.publisher.ofType(NotificationEventType.INCIDENT_ESCALATED)).hasSize(1);
    }

    @Test
    void shouldEscalateWhenBreakerOpenBeforeAnyAttempt() {
        RemediationFixture f = new RemediationFixture(ScriptedLifecycleProvider.alwaysFailing());
        RemediationSettings settings = TestSettings.defaults();
        for (int i = 0; i < 3; i++) {
            f.store.inTransaction(tx -> f.breaker.recordOutcome(tx, SERVICE, false, settings.limits()));
        }
        Incident incident = f.incidents.record(new Finding(SERVICE, FindingKind.CPU_SPIKE, Severity.WARNING,
                Map.of(), f.clock.instant()), settings);

        AttemptOutcome outcome = f.automatic.attempt(incident, settings);

        assertThat(outcome).isEqualTo(AttemptOutcome.BREAKER_OPEN);
        assertThat(f.provider.calls()).isEmpty();
        assertThat(current(f, incident).status()).isEqualTo(IncidentStatus.ESCALATED);
        assertThat(current(f, incident).escalationReason()).contains("OPEN until");
    }

    @Test
    void shouldEscalateWhenRateLimitReachedRegardlessOfBreaker() {
        RemediationFixture f = new RemediationFixture(ScriptedLifecycleProvider.alwaysSucceeding());
        RemediationSettings settings = TestSettings.defaults();
        for (int i = 0; i < 3; i++) {
            Incident incident = healthIncident(f, settings);
            assertThat(f.automatic.attempt(incident, settings)).isEqualTo(AttemptOutcome.SUCCEEDED);
            f.clock.advanceSeconds(30);
        }
        Incident fourth = healthIncident(f, settings);

        AttemptOutcome outcome = f.automatic.attempt(fourth, settings);

        assertThat(outcome).isEqualTo(AttemptOutcome.RATE_LIMITED);
        assertThat(f.provider.restarts()).isEqualTo(3);
        assertThat(f.breaker.currentState(SERVICE).state()).isEqualTo(BreakerState.CLOSED);
        assertThat(current(f, fourth).status()).isEqualTo(IncidentStatus.ESCALATED);
        assertThat(current(f, fourth).escalationReason()).contains("rate limit");
    }

    @Test
    void shouldSkipWithoutEscalatingWhileAnotherAttemptInFlight() {
        RemediationFixture f = new RemediationFixture(ScriptedLifecycleProvider.alwaysSucceeding());
        RemediationSettings settings = TestSettings.defaults();
        Incident incident = healthIncident(f, settings);
        assertThat(f.breaker.acquireForOverride(SERVICE)).isTrue();

        AttemptOutcome outcome = f.automatic.attempt(incident, settings);

        assertThat(outcome).isEqualTo(AttemptOutcome.BUSY);
        assertThat(f.provider.calls()).isEmpty();
        assertThat(current(f, incident).status()).isEqualTo(IncidentStatus.ACTIVE);
        assertThat(f.breaker.isInFlight(SERVICE)).isTrue();
    }

    @Test
    void shouldUseScaleUpForErrorRateWhenConfigured() {
        RemediationFixture f = new RemediationFixture(ScriptedLifecycleProvider.alwaysSucceeding());
        RemediationSettings settings = TestSettings.with(
                new RemediationSettings.ActionPolicy("scale_up", "heal", Map.of(), Map.of()));
        Incident incident = f.incidents.record(new Finding(SERVICE, FindingKind.HIGH_ERROR_RATE, Severity.WARNING,
                Map.of("error_rate", 0.3), f.clock.instant()), settings);

        f.automatic.attempt(incident, settings);

        assertThat(f.provider.calls()).containsExactly("scale:ar_app:1");
        assertThat(f.store.findActions(incident.id()).get(0).actionType()).isEqualTo(ActionType.SCALE_UP);
    }
}
