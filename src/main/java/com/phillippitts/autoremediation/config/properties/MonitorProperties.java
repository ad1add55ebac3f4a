package com.phillippitts.autoremediation.config.properties;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Properties for the orchestration loop.
 */
@Validated
@ConfigurationProperties(prefix = "remediation.monitor")
public class MonitorProperties {

    /** Enable/disable the scheduled loop; the manual endpoint keeps working either way. */
    private boolean enabled = true;

    /** Monitored service names. */
    @NotEmpty(message = "At least one monitored service is required")
    private List<String> services = new ArrayList<>(List.of("ar_app"));

    /** Tick period. */
    @Positive(message = "Tick interval must be positive")
    private long tickIntervalMs = 5000;

    /** Bound on one metrics snapshot call; a slower source counts as unreachable. */
    @Positive(message = "Snapshot timeout must be positive")
    private long snapshotTimeoutMs = 3000;

    /** Minimum gap between two automatic attempts on the same incident. */
    @Positive(message = "Min attempt interval must be positive")
    private long minAttemptIntervalSeconds = 15;

    /** Snapshots kept per service for sustained/growth detection. */
    @Positive(message = "History size must be positive")
    private int historySize = 12;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getServices() {
        return services;
    }

    public void setServices(List<String> services) {
        this.services = services;
    }

    public long getTickIntervalMs() {
        return tickIntervalMs;
    }

    public void setTickIntervalMs(long tickIntervalMs) {
        this.tickIntervalMs = tickIntervalMs;
    }

    public long getSnapshotTimeoutMs() {
        return snapshotTimeoutMs;
    }

    public void setSnapshotTimeoutMs(long snapshotTimeoutMs) {
        this.snapshotTimeoutMs = snapshotTimeoutMs;
    }

    public long getMinAttemptIntervalSeconds() {
        return minAttemptIntervalSeconds;
    }

    public void setMinAttemptIntervalSeconds(long minAttemptIntervalSeconds) {
        this.minAttemptIntervalSeconds = minAttemptIntervalSeconds;
    }

    public int getHistorySize() {
        return historySize;
    }

    public void setHistorySize(int historySize) {
        this.historySize = historySize;
    }
}
