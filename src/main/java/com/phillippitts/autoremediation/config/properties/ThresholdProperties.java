package com.phillippitts.autoremediation.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Detector thresholds.
 */
@Validated
@ConfigurationProperties(prefix = "remediation.thresholds")
public class ThresholdProperties {

    /** Error ratio (0..1) above which a WARNING finding is raised. */
    @DecimalMin(value = "0.0", inclusive = false, message = "Error rate threshold must be above 0")
    @DecimalMax(value = "1.0", message = "Error rate threshold must be at most 1")
    private double errorRate = 0.2;

    /** Error ratio above which the finding is CRITICAL. */
    @DecimalMin(value = "0.0", inclusive = false, message = "Critical error rate must be above 0")
    @DecimalMax(value = "1.0", message = "Critical error rate must be at most 1")
    private double errorRateCritical = 0.6;

    @Positive(message = "CPU threshold must be positive")
    private double cpuPercent = 80.0;

    /** Consecutive breaching ticks (including the current one) that make a CPU finding CRITICAL. */
    @Positive(message = "CPU sustained ticks must be positive")
    private int cpuSustainedTicks = 3;

    /** p95 latency threshold. */
    @Positive(message = "Response time threshold must be positive")
    private double responseTimeMs = 500.0;

    @Positive(message = "Memory threshold must be positive")
    private double memoryMb = 1024.0;

    /** Consecutive snapshots with strictly growing memory that make a memory finding CRITICAL. */
    @Positive(message = "Memory growth ticks must be positive")
    private int memoryGrowthTicks = 4;

    public double getErrorRate() {
        return errorRate;
    }

    public void setErrorRate(double errorRate) {
        this.errorRate = errorRate;
    }

    public double getErrorRateCritical() {
        return errorRateCritical;
    }

    public void setErrorRateCritical(double errorRateCritical) {
        this.errorRateCritical = errorRateCritical;
    }

    public double getCpuPercent() {
        return cpuPercent;
    }

    public void setCpuPercent(double cpuPercent) {
        this.cpuPercent = cpuPercent;
    }

    public int getCpuSustainedTicks() {
        return cpuSustainedTicks;
    }

    public void setCpuSustainedTicks(int cpuSustainedTicks) {
        this.cpuSustainedTicks = cpuSustainedTicks;
    }

    public double getResponseTimeMs() {
        return responseTimeMs;
    }

    public void setResponseTimeMs(double responseTimeMs) {
        this.responseTimeMs = responseTimeMs;
    }

    public double getMemoryMb() {
        return memoryMb;
    }

    public void setMemoryMb(double memoryMb) {
        this.memoryMb = memoryMb;
    }

    public int getMemoryGrowthTicks() {
        return memoryGrowthTicks;
    }

    public void setMemoryGrowthTicks(int memoryGrowthTicks) {
        this.memoryGrowthTicks = memoryGrowthTicks;
    }
}
