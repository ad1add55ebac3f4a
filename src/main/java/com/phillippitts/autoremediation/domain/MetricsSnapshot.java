package com.phillippitts.autoremediation.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time reading of a monitored service.
 *
 * <p>Latency percentiles are {@code null} when the source did not report them. A status code of
 * {@code 0} means no HTTP status is known (for example when the service was unreachable).
 */
public record MetricsSnapshot(
        String service,
        Instant observedAt,
        boolean reachable,
        int statusCode,
        double cpuPercent,
        double memoryMb,
        double errorRate,
        long requests,
        long errors,
        Double p50Ms,
        Double p95Ms,
        Double p99Ms,
        String unreachableReason
) {
    public MetricsSnapshot {
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(observedAt, "observedAt");
    }

    public static MetricsSnapshot unreachable(String service, Instant observedAt, String reason) {
        return new MetricsSnapshot(service, observedAt, false, 0, 0.0, 0.0, 0.0, 0L, 0L,
                null, null, null, reason);
    }

    /** True when the service answered with a 5xx status. */
    public boolean serverError() {
        return statusCode >= 500 && statusCode <= 599;
    }

    /**
     * Error ratio for the current window: {@code errors/requests} when requests were counted,
     * otherwise the rate the source reported.
     */
    public double effectiveErrorRate() {
        if (requests > 0) {
            return (double) errors / (double) requests;
        }
        return errorRate;
    }
}
