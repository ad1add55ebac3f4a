package com.phillippitts.autoremediation.service.metrics;

import com.phillippitts.autoremediation.domain.ActionType;
import com.phillippitts.autoremediation.domain.BreakerState;
import com.phillippitts.autoremediation.domain.FindingKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for detection and remediation.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Findings per kind</li>
 *   <li>Remediation attempts per action type and outcome, with duration</li>
 *   <li>Breaker trips and escalations per service</li>
 *   <li>Current breaker state per service (0 closed, 1 half-open, 2 open)</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class RemediationMetrics {

    private static final String METRIC_PREFIX = "remediation";

    private final MeterRegistry registry;
    private final ConcurrentMap<String, AtomicInteger> breakerStates = new ConcurrentHashMap<>();

    public RemediationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Increments the detection counter for a finding kind.
     *
     * @param kind kind of finding produced
     */
    public void recordDetection(FindingKind kind) {
        Counter.builder(METRIC_PREFIX + ".detections")
                .description("Number of findings produced by detectors")
                .tag("kind", kind.code())
                .register(registry)
                .increment();
    }

    /**
     * Records one remediation attempt.
     *
     * @param actionType action that was executed
     * @param success whether the lifecycle call succeeded
     * @param duration wall-clock execution time
     */
    public void recordAction(ActionType actionType, boolean success, Duration duration) {
        Counter.builder(METRIC_PREFIX + ".actions")
                .description("Number of remediation attempts")
                .tag("action_type", actionType.code())
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".action.duration")
                .description("Time taken by remediation actions")
                .tag("action_type", actionType.code())
                .register(registry)
                .record(duration);
    }

    public void recordBreakerTrip(String service) {
        Counter.builder(METRIC_PREFIX + ".breaker.trips")
                .description("Number of CLOSED/HALF_OPEN to OPEN transitions")
                .tag("service", service)
                .register(registry)
                .increment();
    }

    public void recordEscalation(String service) {
        Counter.builder(METRIC_PREFIX + ".escalations")
                .description("Number of incidents escalated to a human")
                .tag("service", service)
                .register(registry)
                .increment();
    }

    /**
     * Updates the breaker state gauge, registering it the first time a service is seen.
     *
     * @param service service name
     * @param state current breaker state
     */
    public void updateBreakerState(String service, BreakerState state) {
        breakerStates.computeIfAbsent(service, s -> {
            AtomicInteger holder = new AtomicInteger();
            Gauge.builder(METRIC_PREFIX + ".breaker.state", holder, AtomicInteger::get)
                    .description("Circuit breaker state (0 closed, 1 half-open, 2 open)")
                    .tag("service", s)
                    .register(registry);
            return holder;
        }).set(state.gaugeValue());
    }
}
