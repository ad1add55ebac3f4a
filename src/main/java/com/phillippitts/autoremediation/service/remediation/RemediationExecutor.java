package com.phillippitts.autoremediation.service.remediation;

import com.phillippitts.autoremediation.domain.ActionType;
import com.phillippitts.autoremediation.domain.BreakerState;
import com.phillippitts.autoremediation.domain.Incident;
import com.phillippitts.autoremediation.domain.RemediationAction;
import com.phillippitts.autoremediation.domain.RemediationSettings;
import com.phillippitts.autoremediation.domain.Severity;
import com.phillippitts.autoremediation.service.breaker.BreakerTransition;
import com.phillippitts.autoremediation.service.breaker.CircuitBreaker;
import com.phillippitts.autoremediation.service.incident.IncidentManager;
import com.phillippitts.autoremediation.service.metrics.RemediationMetrics;
import com.phillippitts.autoremediation.service.notification.NotificationEvent;
import com.phillippitts.autoremediation.service.notification.NotificationEventType;
import com.phillippitts.autoremediation.service.ratelimit.ActionRateLimiter;
import com.phillippitts.autoremediation.service.store.RemediationStateStore;
import com.phillippitts.autoremediation.util.LogSanitizer;
import com.phillippitts.autoremediation.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Executes one planned action and records its outcome.
 *
 * <p>The lifecycle call is bounded by the settings' lifecycle timeout and a provider error or
 * timeout becomes a failed action. The action, its window entry, the breaker update and the
 * incident transition (resolve on success, escalate when the breaker opened) are then written in
 * a single store transaction.
 *
 * <p>A {@code manual} action touches nothing on the service, so it leaves the breaker's counters
 * alone. {@code remediation_started} is announced before the lifecycle call and records nothing;
 * every other notification is published after the commit.
 *
 * <p>The caller must hold the service's in-flight slot on the {@link CircuitBreaker}.
 */
@Component
public class RemediationExecutor {

    private static final Logger LOG = LogManager.getLogger(RemediationExecutor.class);

    static final int MAX_ERROR_CHARS = 500;

    private final BoundedLifecycleInvoker invoker;
    private final RemediationStateStore store;
    private final ActionRateLimiter rateLimiter;
    private final CircuitBreaker breaker;
    private final IncidentManager incidents;
    private final ApplicationEventPublisher publisher;
    private final RemediationMetrics metrics;
    private final Clock clock;

    public RemediationExecutor(BoundedLifecycleInvoker invoker,
                               RemediationStateStore store,
                               ActionRateLimiter rateLimiter,
                               CircuitBreaker breaker,
                               IncidentManager incidents,
                               ApplicationEventPublisher publisher,
                               RemediationMetrics metrics,
                               Clock clock) {
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.store = Objects.requireNonNull(store, "store");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.breaker = Objects.requireNonNull(breaker, "breaker");
        this.incidents = Objects.requireNonNull(incidents, "incidents");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Executes the plan for an incident.
     *
     * @param incident stored incident being remediated
     * @param plan action and target
     * @param settings current settings snapshot
     * @param triggeredBy {@code bot}, {@code manual} or {@code scheduled}
     * @return the recorded action
     * @throws com.phillippitts.autoremediation.exception.PersistenceException if the outcome
     *         cannot be recorded; nothing of the attempt is stored in that case
     */
    public RemediationAction execute(Incident incident,
                                     RemediationPlan plan,
                                     RemediationSettings settings,
                                     String triggeredBy) {
        String service = incident.service();
        LOG.info("Executing {} on {} for incident {} ({})", plan.actionType().code(), plan.target(),
                incident.id(), plan.reason());
        publisher.publishEvent(new NotificationEvent(NotificationEventType.REMEDIATION_STARTED, service,
                Severity.INFO,
                "Remediation started on " + service + ": " + plan.actionType().code() + " " + plan.target(),
                incident.id(), Map.of("action_type", plan.actionType().code(), "target", plan.target()),
                clock.instant()));

        long start = System.nanoTime();
        LifecycleResult result = invoker.invoke(plan, settings.lifecycleTimeout());
        Duration elapsed = TimeUtils.elapsedSince(start);
        metrics.recordAction(plan.actionType(), result.success(), elapsed);

        RemediationAction attempt = new RemediationAction(0L, UUID.randomUUID(), incident.id(), service,
                plan.actionType(), plan.target(), result.success(),
                result.success() ? null : LogSanitizer.singleLine(result.detail(), MAX_ERROR_CHARS),
                elapsed, triggeredBy, clock.instant());

        return store.inTransaction(tx -> {
            RemediationAction stored = tx.insertAction(attempt);
            rateLimiter.recordAttempt(tx, service, plan.actionType(), result.success());
            BreakerTransition transition = plan.actionType() == ActionType.MANUAL
                    ? BreakerTransition.unchanged(tx.breakerState(service))
                    : breaker.recordOutcome(tx, service, result.success(), settings.limits());
            tx.afterCommit(() -> announce(stored, result, transition));
            if (result.success()) {
                incidents.resolve(tx, incident);
            } else if (transition.to() == BreakerState.OPEN) {
                incidents.escalate(tx, incident, "circuit breaker OPEN after " + transition.after().failureCount()
                        + " failed attempts; last error: " + stored.error());
            }
            return stored;
        });
    }

    private void announce(RemediationAction action, LifecycleResult result, BreakerTransition transition) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("action_type", action.actionType().code());
        details.put("target", action.target());
        details.put("execution_time_ms", action.executionTime().toMillis());
        details.put("triggered_by", action.triggeredBy());
        details.put("breaker_state", transition.to().name());
        if (action.success()) {
            LOG.info("{} on {} succeeded in {} ms", action.actionType().code(), action.target(),
                    action.executionTime().toMillis());
            publisher.publishEvent(new NotificationEvent(NotificationEventType.REMEDIATION_SUCCEEDED,
                    action.service(), Severity.INFO,
                    "Remediation succeeded on " + action.service() + ": " + action.actionType().code(),
                    action.incidentId(), details, action.createdAt()));
        } else {
            details.put("error", action.error());
            LOG.warn("{} on {} failed after {} ms: {}", action.actionType().code(), action.target(),
                    action.executionTime().toMillis(), result.detail());
            publisher.publishEvent(new NotificationEvent(NotificationEventType.REMEDIATION_FAILED,
                    action.service(), Severity.WARNING,
                    "Remediation failed on " + action.service() + ": " + action.actionType().code()
                            + " (" + action.error() + ")",
                    action.incidentId(), details, action.createdAt()));
        }
    }
}
