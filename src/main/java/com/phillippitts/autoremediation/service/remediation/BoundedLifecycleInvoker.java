package com.phillippitts.autoremediation.service.remediation;

import com.phillippitts.autoremediation.domain.ActionType;
import com.phillippitts.autoremediation.exception.LifecycleException;
import com.phillippitts.autoremediation.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a {@link RemediationPlan} against the {@link LifecycleProvider} on the external-call pool
 * with a hard timeout. A call that overruns is cancelled with interruption and reported as a
 * failure; nothing is left in flight. Never throws.
 *
 * <p>The provider receives the same bound with each call. {@code heal} checks health first and
 * restarts only when the check fails, with whatever time the check left. {@code manual} records an
 * operator intervention and makes no provider call.
 */
@Component
public class BoundedLifecycleInvoker {

    private static final Logger LOG = LogManager.getLogger(BoundedLifecycleInvoker.class);

    private final LifecycleProvider provider;
    private final AsyncTaskExecutor executor;

    public BoundedLifecycleInvoker(LifecycleProvider provider,
                                   @Qualifier("lifecycleExecutor") AsyncTaskExecutor executor) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public LifecycleResult invoke(RemediationPlan plan, Duration timeout) {
        if (plan.actionType() == ActionType.MANUAL) {
            return LifecycleResult.ok("operator intervention recorded");
        }
        Future<LifecycleResult> future;
        try {
            future = executor.submit(() -> perform(plan, timeout));
        } catch (RejectedExecutionException e) {
            LOG.warn("Lifecycle pool saturated; {} on {} not started", plan.actionType().code(), plan.target());
            return LifecycleResult.failed("lifecycle pool saturated");
        }
        try {
            LifecycleResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : LifecycleResult.failed("provider returned no result");
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("{} on {} timed out after {} ms", plan.actionType().code(), plan.target(), timeout.toMillis());
            return LifecycleResult.failed("timed out after " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return LifecycleResult.failed("interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof LifecycleException) {
                LOG.warn("{} on {} failed: {}", plan.actionType().code(), plan.target(), cause.getMessage());
                return LifecycleResult.failed(cause.getMessage());
            }
            LOG.error("{} on {} failed unexpectedly", plan.actionType().code(), plan.target(), cause);
            return LifecycleResult.failed(cause.toString());
        }
    }

    private LifecycleResult perform(RemediationPlan plan, Duration timeout) {
        String target = plan.target();
        return switch (plan.actionType()) {
            case RESTART_CONTAINER -> provider.restart(target, timeout);
            case SCALE_UP -> provider.scale(target, 1, timeout);
            case SCALE_DOWN -> provider.scale(target, -1, timeout);
            case HEAL -> heal(target, timeout);
            case MANUAL -> throw new IllegalStateException("No lifecycle operation for " + plan.actionType());
        };
    }

    private LifecycleResult heal(String target, Duration timeout) {
        long start = System.nanoTime();
        LifecycleResult check = provider.health(target, timeout);
        if (check.success()) {
            return LifecycleResult.ok("healthy, no restart needed: " + check.detail());
        }
        Duration remaining = timeout.minus(TimeUtils.elapsedSince(start));
        if (remaining.isNegative() || remaining.isZero()) {
            return LifecycleResult.failed("unhealthy, no time left to restart: " + check.detail());
        }
        LOG.info("Heal: {} unhealthy ({}); restarting", target, check.detail());
        LifecycleResult restart = provider.restart(target, remaining);
        return new LifecycleResult(restart.success(), "unhealthy, restart: " + restart.detail());
    }
}
