package com.phillippitts.autoremediation.domain;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration snapshot taken at the start of each tick and passed explicitly to
 * detectors, the rate limiter, the circuit breaker and the executor.
 *
 * @param services monitored service names
 * @param thresholds detector thresholds
 * @param limits rate limiter and circuit breaker limits
 * @param policy action selection policy
 * @param snapshotTimeout bound on one metrics snapshot call
 * @param minAttemptInterval minimum gap between two automatic attempts on the same incident
 * @param lifecycleTimeout bound on one lifecycle provider call
 * @param historySize number of past snapshots kept per service for detectors
 */
public record RemediationSettings(
        List<String> services,
        Thresholds thresholds,
        Limits limits,
        ActionPolicy policy,
        Duration snapshotTimeout,
        Duration minAttemptInterval,
        Duration lifecycleTimeout,
        int historySize
) {
    public RemediationSettings {
        services = services == null ? List.of() : List.copyOf(services);
        Objects.requireNonNull(thresholds, "thresholds");
        Objects.requireNonNull(limits, "limits");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(snapshotTimeout, "snapshotTimeout");
        Objects.requireNonNull(minAttemptInterval, "minAttemptInterval");
        Objects.requireNonNull(lifecycleTimeout, "lifecycleTimeout");
    }

    /**
     * Detector thresholds.
     *
     * @param errorRate ratio above which an error-rate finding is WARNING
     * @param errorRateCritical ratio above which it becomes CRITICAL
     * @param cpuPercent CPU percentage threshold
     * @param cpuSustainedTicks consecutive breaching ticks that make a CPU finding CRITICAL
     * @param responseTimeMs p95 latency threshold
     * @param memoryMb resident memory threshold
     * @param memoryGrowthTicks consecutive growing ticks that make a memory finding CRITICAL
     */
    public record Thresholds(
            double errorRate,
            double errorRateCritical,
            double cpuPercent,
            int cpuSustainedTicks,
            double responseTimeMs,
            double memoryMb,
            int memoryGrowthTicks
    ) {
    }

    /**
     * Frequency and failure-pattern limits.
     *
     * @param maxActionsPerWindow attempts allowed per (service, action type) within {@code window}
     * @param window rate limiter window; also the trailing period for counting breaker failures
     * @param cooldown time the breaker stays OPEN before a half-open trial attempt
     * @param failureThreshold failures that open the breaker
     * @param successThreshold consecutive half-open successes that close it again
     */
    public record Limits(
            int maxActionsPerWindow,
            Duration window,
            Duration cooldown,
            int failureThreshold,
            int successThreshold
    ) {
        public Limits {
            Objects.requireNonNull(window, "window");
            Objects.requireNonNull(cooldown, "cooldown");
        }
    }

    /**
     * Action selection policy. Codes stay raw strings here and are parsed when an incident is
     * planned, so a bad code only affects the incident that uses it.
     *
     * @param errorRateAction action code for high error rate ({@code restart_container} or {@code scale_up})
     * @param advisoryAction action code for external advisories
     * @param overrides per finding-kind code overrides, keyed by kind code
     * @param targets lifecycle target per service; services without an entry use their own name
     */
    public record ActionPolicy(
            String errorRateAction,
            String advisoryAction,
            Map<String, String> overrides,
            Map<String, String> targets
    ) {
        public ActionPolicy {
            overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
            targets = targets == null ? Map.of() : Map.copyOf(targets);
        }

        public String targetFor(String service) {
            String target = targets.get(service);
            return target == null || target.isBlank() ? service : target;
        }
    }
}
