package com.phillippitts.autoremediation.config.settings;

import com.phillippitts.autoremediation.config.properties.MonitorProperties;
import com.phillippitts.autoremediation.config.properties.RemediationProperties;
import com.phillippitts.autoremediation.config.properties.ThresholdProperties;
import com.phillippitts.autoremediation.domain.RemediationSettings;

import java.time.Duration;
import java.util.Objects;

/**
 * Builds a fresh {@link RemediationSettings} from the bound properties on every call.
 */
public class PropertiesConfigSource implements ConfigSource {

    private final MonitorProperties monitor;
    private final ThresholdProperties thresholds;
    private final RemediationProperties policy;

    public PropertiesConfigSource(MonitorProperties monitor,
                                  ThresholdProperties thresholds,
                                  RemediationProperties policy) {
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    @Override
    public RemediationSettings current() {
        return new RemediationSettings(
                monitor.getServices(),
                new RemediationSettings.Thresholds(
                        thresholds.getErrorRate(),
                        thresholds.getErrorRateCritical(),
                        thresholds.getCpuPercent(),
                        thresholds.getCpuSustainedTicks(),
                        thresholds.getResponseTimeMs(),
                        thresholds.getMemoryMb(),
                        thresholds.getMemoryGrowthTicks()),
                new RemediationSettings.Limits(
                        policy.getMaxActionsPerWindow(),
                        Duration.ofSeconds(policy.getWindowSeconds()),
                        Duration.ofSeconds(policy.getCooldownSeconds()),
                        policy.getFailureThreshold(),
                        policy.getSuccessThreshold()),
                new RemediationSettings.ActionPolicy(
                        policy.getErrorRateAction(),
                        policy.getAdvisoryAction(),
                        policy.getOverrides(),
                        policy.getTargets()),
                Duration.ofMillis(monitor.getSnapshotTimeoutMs()),
                Duration.ofSeconds(monitor.getMinAttemptIntervalSeconds()),
                Duration.ofMillis(policy.getLifecycleTimeoutMs()),
                monitor.getHistorySize());
    }
}
