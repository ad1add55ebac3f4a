package com.phillippitts.autoremediation.presentation.endpoint;

import com.phillippitts.autoremediation.domain.Finding;
import com.phillippitts.autoremediation.domain.FindingKind;
import com.phillippitts.autoremediation.domain.Incident;
import com.phillippitts.autoremediation.domain.IncidentStatus;
import com.phillippitts.autoremediation.domain.RemediationSettings;
import com.phillippitts.autoremediation.domain.Severity;
import com.phillippitts.autoremediation.service.remediation.ManualRemediationService;
import com.phillippitts.autoremediation.testutil.RemediationFixture;
import com.phillippitts.autoremediation.testutil.ScriptedLifecycleProvider;
import com.phillippitts.autoremediation.testutil.TestSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.endpoint.web.WebEndpointResponse;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RemediationEndpointTest {

    private final RemediationSettings settings = TestSettings.defaults();
    private RemediationFixture f;
    private RemediationEndpoint endpoint;

    @BeforeEach
    void setUp() {
        f = new RemediationFixture(ScriptedLifecycleProvider.alwaysSucceeding());
        ManualRemediationService manual = new ManualRemediationService(f.store, f.breaker, f.executor,
                () -> settings);
        endpoint = new RemediationEndpoint(() -> settings, f.breaker, f.store, manual);
    }

    private Incident openIncident() {
        return f.incidents.record(new Finding(TestSettings.SERVICE, FindingKind.MEMORY_LEAK, Severity.CRITICAL,
                Map.of("memory_usage_mb", 2048.0), f.clock.instant()), settings);
    }

    @Test
    @SuppressWarnings("unchecked")
    void overviewListsBreakersAndOpenIncidents() {
        Incident incident = openIncident();

        Map<String, Object> body = endpoint.overview();

        Map<String, Object> breakers = (Map<String, Object>) body.get("breakers");
        assertThat((Map<String, Object>) breakers.get("ar_app")).containsEntry("state", "CLOSED");
        List<Map<String, Object>> incidents = (List<Map<String, Object>>) body.get("incidents");
        assertThat(incidents).singleElement().satisfies(view -> {
            assertThat(view).containsEntry("id", incident.id());
            assertThat(view).containsEntry("kind", "memory_leak");
            assertThat(view).containsEntry("status", "ACTIVE");
        });
    }

    @Test
    void runsManualActionOnIncident() {
        Incident incident = openIncident();

        WebEndpointResponse<Map<String, Object>> response =
                endpoint.control("incidents", Long.toString(incident.id()), "restart_container", "alice");

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getBody()).containsEntry("success", true).containsEntry("actionType", "restart_container");
        assertThat(f.store.findIncident(incident.id()).orElseThrow().status()).isEqualTo(IncidentStatus.RESOLVED);
    }

    @Test
    void rejectsBadRequests() {
        Incident incident = openIncident();

        assertThat(endpoint.control("incidents", "abc", "heal", "alice").getStatus()).isEqualTo(400);
        assertThat(endpoint.control("incidents", Long.toString(incident.id()), null, "alice").getStatus())
                .isEqualTo(400);
        assertThat(endpoint.control("incidents", Long.toString(incident.id()), "reboot_host", "alice").getStatus())
                .isEqualTo(400);
        assertThat(endpoint.control("incidents", "999", "heal", "alice").getStatus()).isEqualTo(400);
        assertThat(endpoint.control("widgets", "1", null, null).getStatus()).isEqualTo(404);
        assertThat(f.provider.calls()).isEmpty();
    }

    @Test
    void reportsConflictForResolvedIncident() {
        Incident incident = openIncident();
        f.incidents.resolve(incident.id());

        WebEndpointResponse<Map<String, Object>> response =
                endpoint.control("incidents", Long.toString(incident.id()), "heal", null);

        assertThat(response.getStatus()).isEqualTo(409);
        assertThat(response.getBody()).containsKey("error");
    }

    @Test
    void resetsBreaker() {
        for (int i = 0; i < 3; i++) {
            f.store.inTransaction(tx -> f.breaker.recordOutcome(tx, TestSettings.SERVICE, false, settings.limits()));
        }

        WebEndpointResponse<Map<String, Object>> response = endpoint.control("breakers", "ar_app", null, "alice");

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getBody()).containsEntry("state", "CLOSED").containsEntry("failureCount", 0);
    }
}
