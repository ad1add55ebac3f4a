package com.phillippitts.autoremediation.service.snapshot;

import com.phillippitts.autoremediation.domain.MetricsSnapshot;
import com.phillippitts.autoremediation.exception.SnapshotUnavailableException;
import com.phillippitts.autoremediation.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls the {@link MetricsSnapshotProvider} on the external-call pool with a hard timeout; a call
 * that overruns is cancelled with interruption.
 *
 * <p>Failures of the provider call, including a timeout, become a {@code reachable=false}
 * snapshot so they surface as a health-check finding. When the call never reached the provider
 * (pool saturated, caller interrupted) nothing is known about the service and the result is empty.
 */
@Component
public class SnapshotCollector {

    private static final Logger LOG = LogManager.getLogger(SnapshotCollector.class);

    private static final int MAX_REASON_CHARS = 200;

    private final MetricsSnapshotProvider provider;
    private final AsyncTaskExecutor executor;
    private final Clock clock;

    public SnapshotCollector(MetricsSnapshotProvider provider,
                             @Qualifier("lifecycleExecutor") AsyncTaskExecutor executor,
                             Clock clock) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Fetches one snapshot within {@code timeout}.
     *
     * @return the snapshot, unreachable when the provider failed or overran; empty when the
     *         provider was never asked
     */
    public Optional<MetricsSnapshot> collect(String service, Duration timeout) {
        Future<MetricsSnapshot> future;
        try {
            future = executor.submit(() -> provider.fetch(service));
        } catch (RejectedExecutionException e) {
            LOG.warn("Snapshot for {} not scheduled: pool saturated", service);
            return Optional.empty();
        }
        try {
            MetricsSnapshot snapshot = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return Optional.of(snapshot != null ? snapshot
                    : MetricsSnapshot.unreachable(service, clock.instant(), "empty_snapshot"));
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Snapshot for {} timed out after {} ms", service, timeout.toMillis());
            return Optional.of(MetricsSnapshot.unreachable(service, clock.instant(), "timeout"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            LOG.warn("Snapshot for {} abandoned: interrupted", service);
            return Optional.empty();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String reason = cause instanceof SnapshotUnavailableException
                    ? cause.getMessage()
                    : cause.toString();
            reason = LogSanitizer.truncate(reason, MAX_REASON_CHARS);
            LOG.warn("Snapshot for {} unavailable: {}", service, reason);
            return Optional.of(MetricsSnapshot.unreachable(service, clock.instant(), reason));
        }
    }
}
