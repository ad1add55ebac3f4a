package com.phillippitts.autoremediation.service.remediation;

import com.phillippitts.autoremediation.config.settings.ConfigSource;
import com.phillippitts.autoremediation.domain.ActionType;
import com.phillippitts.autoremediation.domain.CircuitBreakerState;
import com.phillippitts.autoremediation.domain.Incident;
import com.phillippitts.autoremediation.domain.IncidentStatus;
import com.phillippitts.autoremediation.domain.RemediationAction;
import com.phillippitts.autoremediation.domain.RemediationSettings;
import com.phillippitts.autoremediation.service.breaker.CircuitBreaker;
import com.phillippitts.autoremediation.service.store.RemediationStateStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Operator-initiated actions.
 *
 * <p>Manual actions bypass the rate limiter and the breaker gate but still take the service's
 * in-flight slot, so they never overlap an automatic attempt, and are recorded exactly like
 * automatic ones (action, window entry, breaker outcome, incident transition).
 */
@Service
public class ManualRemediationService {

    private static final Logger LOG = LogManager.getLogger(ManualRemediationService.class);

    public static final String TRIGGERED_BY_MANUAL = "manual";

    private final RemediationStateStore store;
    private final CircuitBreaker breaker;
    private final RemediationExecutor executor;
    private final ConfigSource configSource;

    public ManualRemediationService(RemediationStateStore store,
                                    CircuitBreaker breaker,
                                    RemediationExecutor executor,
                                    ConfigSource configSource) {
        this.store = Objects.requireNonNull(store, "store");
        this.breaker = Objects.requireNonNull(breaker, "breaker");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.configSource = Objects.requireNonNull(configSource, "configSource");
    }

    /**
     * Runs an operator action against an ACTIVE or ESCALATED incident.
     *
     * @param incidentId incident to act on
     * @param actionType action to run; {@code manual} records an intervention without a provider call
     * @param operator who requested it, for the log
     * @return the recorded action
     * @throws IllegalArgumentException if the incident does not exist
     * @throws IllegalStateException if the incident is resolved or an attempt is already in flight
     */
    public RemediationAction execute(long incidentId, ActionType actionType, String operator) {
        Objects.requireNonNull(actionType, "actionType");
        Incident incident = store.findIncident(incidentId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown incident id: " + incidentId));
        if (incident.status() == IncidentStatus.RESOLVED) {
            throw new IllegalStateException("Incident " + incidentId + " is already resolved");
        }
        RemediationSettings settings = configSource.current();
        RemediationPlan plan = new RemediationPlan(actionType, settings.policy().targetFor(incident.service()),
                "manual request by " + operator);
        if (!breaker.acquireForOverride(incident.service())) {
            throw new IllegalStateException("A remediation is already in flight for " + incident.service());
        }
        try {
            LOG.warn("Operator {} requested {} for incident {} on {}", operator, actionType.code(), incidentId,
                    incident.service());
            return executor.execute(incident, plan, settings, TRIGGERED_BY_MANUAL);
        } finally {
            breaker.release(incident.service());
        }
    }

    /**
     * Forces a service's breaker back to CLOSED.
     */
    public CircuitBreakerState resetBreaker(String service, String operator) {
        LOG.warn("Operator {} reset the circuit breaker for {}", operator, service);
        return breaker.reset(service);
    }
}
