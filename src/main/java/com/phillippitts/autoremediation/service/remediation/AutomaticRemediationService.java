package com.phillippitts.autoremediation.service.remediation;

import com.phillippitts.autoremediation.domain.Incident;
import com.phillippitts.autoremediation.domain.RemediationAction;
import com.phillippitts.autoremediation.domain.RemediationSettings;
import com.phillippitts.autoremediation.service.breaker.BreakerDecision;
import com.phillippitts.autoremediation.service.breaker.CircuitBreaker;
import com.phillippitts.autoremediation.service.incident.IncidentManager;
import com.phillippitts.autoremediation.service.ratelimit.ActionRateLimiter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Gates an automatic attempt: rate limiter first, then circuit breaker, then execution.
 *
 * <p>A rate-limited attempt or an OPEN breaker escalates the incident right away so an operator
 * is alerted instead of the service being silently starved. A busy breaker (attempt already in
 * flight) or an unreadable breaker state leaves the incident ACTIVE for the next tick.
 */
@Service
public class AutomaticRemediationService {

    private static final Logger LOG = LogManager.getLogger(AutomaticRemediationService.class);

    private final RemediationPolicy policy;
    private final ActionRateLimiter rateLimiter;
    private final CircuitBreaker breaker;
    private final RemediationExecutor executor;
    private final IncidentManager incidents;

    public AutomaticRemediationService(RemediationPolicy policy,
                                       ActionRateLimiter rateLimiter,
                                       CircuitBreaker breaker,
                                       RemediationExecutor executor,
                                       IncidentManager incidents) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.breaker = Objects.requireNonNull(breaker, "breaker");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.incidents = Objects.requireNonNull(incidents, "incidents");
    }

    /**
     * Attempts remediation of an ACTIVE incident.
     *
     * @throws com.phillippitts.autoremediation.exception.UnknownActionTypeException if the
     *         policy names an unknown action for this incident
     * @throws com.phillippitts.autoremediation.exception.PersistenceException if an escalation or
     *         the outcome cannot be recorded
     */
    public AttemptOutcome attempt(Incident incident, RemediationSettings settings) {
        RemediationPlan plan = policy.planFor(incident, settings);
        RemediationSettings.Limits limits = settings.limits();
        String service = incident.service();

        if (!rateLimiter.allow(service, plan.actionType(), limits)) {
            incidents.escalate(incident.id(), "rate limit reached: " + limits.maxActionsPerWindow() + " "
                    + plan.actionType().code() + " attempts within " + limits.window().toSeconds() + "s");
            return AttemptOutcome.RATE_LIMITED;
        }

        BreakerDecision decision = breaker.allow(service, limits);
        switch (decision.verdict()) {
            case BUSY -> {
                LOG.debug("Skipping incident {}: {}", incident.id(), decision.reason());
                return AttemptOutcome.BUSY;
            }
            case UNAVAILABLE -> {
                LOG.warn("Skipping incident {} this tick: {}", incident.id(), decision.reason());
                return AttemptOutcome.UNAVAILABLE;
            }
            case OPEN -> {
                incidents.escalate(incident.id(), decision.reason());
                return AttemptOutcome.BREAKER_OPEN;
            }
            case ALLOWED -> LOG.debug("Breaker {} for {}; attempting incident {}", decision.state(), service,
                    incident.id());
        }

        try {
            RemediationAction action = executor.execute(incident, plan, settings, RemediationAction.TRIGGERED_BY_BOT);
            return action.success() ? AttemptOutcome.SUCCEEDED : AttemptOutcome.FAILED;
        } finally {
            breaker.release(service);
        }
    }
}
