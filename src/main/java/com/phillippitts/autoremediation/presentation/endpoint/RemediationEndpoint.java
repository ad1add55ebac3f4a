package com.phillippitts.autoremediation.presentation.endpoint;

import com.phillippitts.autoremediation.config.settings.ConfigSource;
import com.phillippitts.autoremediation.domain.ActionType;
import com.phillippitts.autoremediation.domain.CircuitBreakerState;
import com.phillippitts.autoremediation.domain.Incident;
import com.phillippitts.autoremediation.domain.IncidentStatus;
import com.phillippitts.autoremediation.domain.RemediationAction;
import com.phillippitts.autoremediation.exception.UnknownActionTypeException;
import com.phillippitts.autoremediation.service.breaker.CircuitBreaker;
import com.phillippitts.autoremediation.service.remediation.ManualRemediationService;
import com.phillippitts.autoremediation.service.store.RemediationStateStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.Selector;
import org.springframework.boot.actuate.endpoint.annotation.WriteOperation;
import org.springframework.boot.actuate.endpoint.web.WebEndpointResponse;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator view and manual control at {@code /actuator/remediation}.
 *
 * <ul>
 *   <li>{@code GET /actuator/remediation} - breaker per monitored service and open incidents</li>
 *   <li>{@code POST /actuator/remediation/incidents/{incidentId}} with
 *       {@code {"action": "restart_container", "operator": "alice"}} - manual action</li>
 *   <li>{@code POST /actuator/remediation/breakers/{service}} with {@code {"operator": "alice"}}
 *       - reset the breaker to CLOSED</li>
 * </ul>
 */
@Component
@Endpoint(id = "remediation")
public class RemediationEndpoint {

    private static final Logger LOG = LogManager.getLogger(RemediationEndpoint.class);

    static final String INCIDENTS = "incidents";
    static final String BREAKERS = "breakers";
    private static final String UNKNOWN_OPERATOR = "unknown";

    private final ConfigSource configSource;
    private final CircuitBreaker breaker;
    private final RemediationStateStore store;
    private final ManualRemediationService manual;

    public RemediationEndpoint(ConfigSource configSource,
                               CircuitBreaker breaker,
                               RemediationStateStore store,
                               ManualRemediationService manual) {
        this.configSource = configSource;
        this.breaker = breaker;
        this.store = store;
        this.manual = manual;
    }

    @ReadOperation
    public Map<String, Object> overview() {
        Map<String, Object> breakers = new LinkedHashMap<>();
        for (String service : configSource.current().services()) {
            breakers.put(service, describe(breaker.currentState(service)));
        }
        List<Map<String, Object>> open = new ArrayList<>();
        for (Incident incident : store.findIncidentsByStatus(null, IncidentStatus.ACTIVE)) {
            open.add(describe(incident));
        }
        for (Incident incident : store.findIncidentsByStatus(null, IncidentStatus.ESCALATED)) {
            open.add(describe(incident));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(BREAKERS, breakers);
        body.put(INCIDENTS, open);
        return body;
    }

    @WriteOperation
    public WebEndpointResponse<Map<String, Object>> control(@Selector String resource,
                                                            @Selector String id,
                                                            @Nullable String action,
                                                            @Nullable String operator) {
        String who = operator == null || operator.isBlank() ? UNKNOWN_OPERATOR : operator;
        try {
            if (INCIDENTS.equals(resource)) {
                return runAction(id, action, who);
            }
            if (BREAKERS.equals(resource)) {
                CircuitBreakerState state = manual.resetBreaker(id, who);
                return new WebEndpointResponse<>(describe(state), WebEndpointResponse.STATUS_OK);
            }
            return error(WebEndpointResponse.STATUS_NOT_FOUND, "Unknown resource: " + resource);
        } catch (IllegalArgumentException | UnknownActionTypeException e) {
            return error(WebEndpointResponse.STATUS_BAD_REQUEST, e.getMessage());
        } catch (IllegalStateException e) {
            return error(409, e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Manual {} request for {} failed", resource, id, e);
            return error(WebEndpointResponse.STATUS_INTERNAL_SERVER_ERROR, "Request could not be completed");
        }
    }

    private WebEndpointResponse<Map<String, Object>> runAction(String id, String action, String operator) {
        long incidentId;
        try {
            incidentId = Long.parseLong(id);
        } catch (NumberFormatException e) {
            return error(WebEndpointResponse.STATUS_BAD_REQUEST, "Incident id must be numeric: " + id);
        }
        if (action == null || action.isBlank()) {
            return error(WebEndpointResponse.STATUS_BAD_REQUEST, "action is required");
        }
        RemediationAction recorded = manual.execute(incidentId, ActionType.fromCode(action), operator);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("actionId", recorded.id());
        body.put("incidentId", recorded.incidentId());
        body.put("actionType", recorded.actionType().code());
        body.put("target", recorded.target());
        body.put("success", recorded.success());
        body.put("error", recorded.error());
        body.put("executionTimeMs", recorded.executionTime().toMillis());
        return new WebEndpointResponse<>(body, WebEndpointResponse.STATUS_OK);
    }

    private static Map<String, Object> describe(CircuitBreakerState state) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("state", state.state().name());
        view.put("failureCount", state.failureCount());
        view.put("successCount", state.successCount());
        view.put("openedAt", state.openedAt());
        view.put("lastFailureAt", state.lastFailureAt());
        return view;
    }

    private static Map<String, Object> describe(Incident incident) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", incident.id());
        view.put("service", incident.service());
        view.put("kind", incident.kind().code());
        view.put("severity", incident.severity().name());
        view.put("status", incident.status().name());
        view.put("createdAt", incident.createdAt());
        view.put("escalationReason", incident.escalationReason());
        return view;
    }

    private static WebEndpointResponse<Map<String, Object>> error(int status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        return new WebEndpointResponse<>(body, status);
    }
}
