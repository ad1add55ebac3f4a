package com.phillippitts.autoremediation.service.breaker;

import com.phillippitts.autoremediation.domain.BreakerState;
import com.phillippitts.autoremediation.domain.CircuitBreakerState;
import com.phillippitts.autoremediation.domain.RemediationSettings;
import com.phillippitts.autoremediation.domain.Severity;
import com.phillippitts.autoremediation.exception.PersistenceException;
import com.phillippitts.autoremediation.service.metrics.RemediationMetrics;
import com.phillippitts.autoremediation.service.notification.NotificationEvent;
import com.phillippitts.autoremediation.service.notification.NotificationEventType;
import com.phillippitts.autoremediation.service.store.RemediationStateStore;
import com.phillippitts.autoremediation.service.store.StoreTransaction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-service circuit breaker over the persisted {@link CircuitBreakerState}.
 *
 * <p>State machine:
 * <ul>
 *   <li>CLOSED: attempts allowed. Failures within the trailing window are counted and
 *       {@code failureThreshold} of them open the breaker. A success resets the count.</li>
 *   <li>OPEN: attempts denied until {@code cooldown} has elapsed since {@code openedAt}; the next
 *       check after that moves to HALF_OPEN.</li>
 *   <li>HALF_OPEN: one attempt at a time. {@code successThreshold} consecutive successes close
 *       the breaker, any failure reopens it.</li>
 * </ul>
 *
 * <p>{@link #allow} hands out a single in-flight slot per service, so concurrent checks for the
 * same service observe BUSY until the slot holder calls {@link #release}. Outcomes are recorded
 * inside the caller's store transaction together with the action itself.
 *
 * <p>Lock order is breaker lock, then store lock. {@link #recordOutcome} runs inside a store
 * transaction and therefore never takes the breaker lock.
 */
@Component
public class CircuitBreaker {

    private static final Logger LOG = LogManager.getLogger(CircuitBreaker.class);

    private final RemediationStateStore store;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;
    private final RemediationMetrics metrics;

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public CircuitBreaker(RemediationStateStore store,
                          Clock clock,
                          ApplicationEventPublisher publisher,
                          RemediationMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Decides whether an automatic attempt may start now. On {@link BreakerDecision.Verdict#ALLOWED}
     * the caller holds the service's in-flight slot and must call {@link #release} when done.
     *
     * @param service service to remediate
     * @param limits limits from the current settings snapshot
     * @return decision; never throws
     */
    public BreakerDecision allow(String service, RemediationSettings.Limits limits) {
        ReentrantLock lock = lockFor(service);
        lock.lock();
        try {
            CircuitBreakerState current = store.findBreakerState(service)
                    .orElseGet(() -> CircuitBreakerState.closed(service));
            if (inFlight.contains(service)) {
                return BreakerDecision.busy(current.state());
            }
            if (current.state() == BreakerState.OPEN) {
                Instant now = clock.instant();
                Instant retryAt = current.openedAt() == null ? now : current.openedAt().plus(limits.cooldown());
                if (now.isBefore(retryAt)) {
                    LOG.debug("Breaker OPEN for {} until {}", service, retryAt);
                    return BreakerDecision.open("circuit breaker OPEN until " + retryAt);
                }
                CircuitBreakerState halfOpen = current.toHalfOpen();
                store.inTransaction(tx -> {
                    tx.saveBreakerState(halfOpen);
                    return null;
                });
                metrics.updateBreakerState(service, BreakerState.HALF_OPEN);
                LOG.info("Breaker for {} moved OPEN -> HALF_OPEN after cooldown of {}s",
                        service, limits.cooldown().toSeconds());
                current = halfOpen;
            }
            inFlight.add(service);
            return BreakerDecision.allowed(current.state());
        } catch (RuntimeException e) {
            LOG.error("Breaker state unavailable for {}: {}", service, e.toString());
            return BreakerDecision.unavailable("breaker state unavailable: " + e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes the in-flight slot regardless of breaker state. Used for operator actions, which are
     * honored even when the breaker is OPEN but must not overlap an automatic attempt.
     *
     * @return false when another attempt is already in flight
     */
    public boolean acquireForOverride(String service) {
        ReentrantLock lock = lockFor(service);
        lock.lock();
        try {
            return inFlight.add(service);
        } finally {
            lock.unlock();
        }
    }

    /** Releases the in-flight slot taken by {@link #allow} or {@link #acquireForOverride}. */
    public void release(String service) {
        inFlight.remove(service);
    }

    public boolean isInFlight(String service) {
        return inFlight.contains(service);
    }

    /**
     * Applies one attempt's outcome to the breaker inside the caller's transaction.
     *
     * @param tx open store transaction that also records the action
     * @param service remediated service
     * @param success whether the attempt succeeded
     * @param limits limits from the current settings snapshot
     * @return the transition, which may leave the state unchanged
     */
    public BreakerTransition recordOutcome(StoreTransaction tx,
                                           String service,
                                           boolean success,
                                           RemediationSettings.Limits limits) {
        Instant now = clock.instant();
        CircuitBreakerState before = tx.breakerState(service);
        CircuitBreakerState after = success ? onSuccess(before, now, limits) : onFailure(before, now, limits);
        tx.saveBreakerState(after);
        BreakerTransition transition = new BreakerTransition(before.state(), after);

        tx.afterCommit(() -> metrics.updateBreakerState(service, after.state()));
        if (transition.opened()) {
            tx.afterCommit(() -> {
                metrics.recordBreakerTrip(service);
                LOG.error("Circuit breaker OPEN for {} (failures={}, cooldown={}s)",
                        service, after.failureCount(), limits.cooldown().toSeconds());
                publisher.publishEvent(new NotificationEvent(NotificationEventType.CIRCUIT_OPENED, service,
                        Severity.CRITICAL,
                        "Circuit breaker opened for " + service + "; automatic remediation paused for "
                                + limits.cooldown().toSeconds() + "s",
                        null,
                        Map.of("failure_count", after.failureCount(),
                                "cooldown_seconds", limits.cooldown().toSeconds()),
                        now));
            });
        } else if (transition.closed()) {
            tx.afterCommit(() -> LOG.info("Circuit breaker CLOSED for {}", service));
        }
        return transition;
    }

    private CircuitBreakerState onSuccess(CircuitBreakerState s, Instant now, RemediationSettings.Limits limits) {
        return switch (s.state()) {
            case HALF_OPEN -> s.successCount() + 1 >= limits.successThreshold()
                    ? new CircuitBreakerState(s.service(), BreakerState.CLOSED, 0, 0, s.lastFailureAt(), null, now)
                    : new CircuitBreakerState(s.service(), BreakerState.HALF_OPEN, s.failureCount(),
                            s.successCount() + 1, s.lastFailureAt(), s.openedAt(), now);
            case OPEN -> new CircuitBreakerState(s.service(), BreakerState.OPEN, s.failureCount(), s.successCount(),
                    s.lastFailureAt(), s.openedAt(), now);
            case CLOSED -> new CircuitBreakerState(s.service(), BreakerState.CLOSED, 0, 0,
                    s.lastFailureAt(), null, now);
        };
    }

    private CircuitBreakerState onFailure(CircuitBreakerState s, Instant now, RemediationSettings.Limits limits) {
        return switch (s.state()) {
            case HALF_OPEN -> new CircuitBreakerState(s.service(), BreakerState.OPEN, s.failureCount() + 1, 0,
                    now, now, s.lastSuccessAt());
            case OPEN -> new CircuitBreakerState(s.service(), BreakerState.OPEN, s.failureCount() + 1,
                    s.successCount(), now, s.openedAt(), s.lastSuccessAt());
            case CLOSED -> onClosedFailure(s, now, limits);
        };
    }

    private static CircuitBreakerState onClosedFailure(CircuitBreakerState s, Instant now,
                                                       RemediationSettings.Limits limits) {
        boolean stale = s.lastFailureAt() != null && s.lastFailureAt().isBefore(now.minus(limits.window()));
        int failures = (stale ? 0 : s.failureCount()) + 1;
        if (failures >= limits.failureThreshold()) {
            return new CircuitBreakerState(s.service(), BreakerState.OPEN, failures, 0, now, now, s.lastSuccessAt());
        }
        return new CircuitBreakerState(s.service(), BreakerState.CLOSED, failures, 0, now, null, s.lastSuccessAt());
    }

    /**
     * Forces the breaker back to CLOSED with cleared counters.
     *
     * @throws PersistenceException if the new state cannot be stored
     */
    public CircuitBreakerState reset(String service) {
        ReentrantLock lock = lockFor(service);
        lock.lock();
        try {
            CircuitBreakerState previous = currentState(service);
            CircuitBreakerState closed = new CircuitBreakerState(service, BreakerState.CLOSED, 0, 0,
                    previous.lastFailureAt(), null, previous.lastSuccessAt());
            store.inTransaction(tx -> {
                tx.saveBreakerState(closed);
                return null;
            });
            metrics.updateBreakerState(service, BreakerState.CLOSED);
            LOG.warn("Breaker for {} reset to CLOSED (was {})", service, previous.state());
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /** Persisted breaker state; CLOSED for a service that has no record yet. */
    public CircuitBreakerState currentState(String service) {
        return store.findBreakerState(service).orElseGet(() -> CircuitBreakerState.closed(service));
    }

    private ReentrantLock lockFor(String service) {
        return locks.computeIfAbsent(service, s -> new ReentrantLock());
    }
}
