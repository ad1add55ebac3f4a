package com.phillippitts.autoremediation.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Remediation policy: frequency cap, circuit breaker limits and action selection.
 */
@Validated
@ConfigurationProperties(prefix = "remediation.policy")
public class RemediationProperties {

    /** Attempts allowed per (service, action type) within the window. */
    @Positive(message = "Max actions per window must be positive")
    private int maxActionsPerWindow = 3;

    /** Rate limiter window, also the trailing period for counting breaker failures. */
    @Positive(message = "Window seconds must be positive")
    private long windowSeconds = 300;

    /** Time the breaker stays OPEN before allowing a trial attempt. */
    @Positive(message = "Cooldown seconds must be positive")
    private long cooldownSeconds = 120;

    @Positive(message = "Failure threshold must be positive")
    private int failureThreshold = 3;

    @Positive(message = "Success threshold must be positive")
    private int successThreshold = 1;

    /** Bound on one lifecycle provider call. */
    @Positive(message = "Lifecycle timeout must be positive")
    private long lifecycleTimeoutMs = 10_000;

    /** Action for high_error_rate incidents: restart_container or scale_up. */
    @NotBlank
    private String errorRateAction = "restart_container";

    /** Action for external_advisory incidents. */
    @NotBlank
    private String advisoryAction = "heal";

    /** Finding kind code to action code; takes precedence over the defaults. */
    private Map<String, String> overrides = new LinkedHashMap<>();

    /** Service name to lifecycle target (container name); defaults to the service name. */
    private Map<String, String> targets = new LinkedHashMap<>();

    public int getMaxActionsPerWindow() {
        return maxActionsPerWindow;
    }

    public void setMaxActionsPerWindow(int maxActionsPerWindow) {
        this.maxActionsPerWindow = maxActionsPerWindow;
    }

    public long getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(long windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public long getCooldownSeconds() {
        return cooldownSeconds;
    }

    public void setCooldownSeconds(long cooldownSeconds) {
        this.cooldownSeconds = cooldownSeconds;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
        this.failureThreshold = failureThreshold;
    }

    public int getSuccessThreshold() {
        return successThreshold;
    }

    public void setSuccessThreshold(int successThreshold) {
        this.successThreshold = successThreshold;
    }

    public long getLifecycleTimeoutMs() {
        return lifecycleTimeoutMs;
    }

    public void setLifecycleTimeoutMs(long lifecycleTimeoutMs) {
        this.lifecycleTimeoutMs = lifecycleTimeoutMs;
    }

    public String getErrorRateAction() {
        return errorRateAction;
    }

    public void setErrorRateAction(String errorRateAction) {
        this.errorRateAction = errorRateAction;
    }

    public String getAdvisoryAction() {
        return advisoryAction;
    }

    public void setAdvisoryAction(String advisoryAction) {
        this.advisoryAction = advisoryAction;
    }

    public Map<String, String> getOverrides() {
        return overrides;
    }

    public void setOverrides(Map<String, String> overrides) {
        this.overrides = overrides;
    }

    public Map<String, String> getTargets() {
        return targets;
    }

    public void setTargets(Map<String, String> targets) {
        this.targets = targets;
    }
}
