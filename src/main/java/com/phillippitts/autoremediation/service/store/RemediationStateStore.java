package com.phillippitts.autoremediation.service.store;

import com.phillippitts.autoremediation.domain.ActionType;
import com.phillippitts.autoremediation.domain.CircuitBreakerState;
import com.phillippitts.autoremediation.domain.FindingKind;
import com.phillippitts.autoremediation.domain.Incident;
import com.phillippitts.autoremediation.domain.IncidentStatus;
import com.phillippitts.autoremediation.domain.RemediationAction;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable state for incidents, remediation actions, circuit breaker records and the
 * action window.
 *
 * <p>Reads are available directly. Writes only happen inside {@link #inTransaction}, so an
 * action, its window entry, the breaker update and the incident transition either all become
 * visible or none of them do.
 *
 * <p>Implementations signal storage failures with
 * {@link com.phillippitts.autoremediation.exception.PersistenceException}.
 */
public interface RemediationStateStore {

    Optional<Incident> findIncident(long id);

    /** The ACTIVE incident for {@code (service, kind)}; there is never more than one. */
    Optional<Incident> findActiveIncident(String service, FindingKind kind);

    /** Most recently escalated incident for {@code (service, kind)}, if any. */
    Optional<Incident> findLatestEscalated(String service, FindingKind kind);

    /**
     * Incidents in the given status, oldest first.
     *
     * @param service service name, or {@code null} for all services
     * @param status status to match
     */
    List<Incident> findIncidentsByStatus(String service, IncidentStatus status);

    /** Actions recorded for an incident, in the order they were written. */
    List<RemediationAction> findActions(long incidentId);

    Optional<CircuitBreakerState> findBreakerState(String service);

    List<CircuitBreakerState> findBreakerStates();

    /** Counts window entries for {@code (service, actionType)} with a timestamp at or after {@code since}. */
    int countActionWindowEntries(String service, ActionType actionType, Instant since);

    /**
     * Runs the callback and commits its staged writes atomically. If the callback throws, every
     * staged write and after-commit hook is discarded and the exception propagates.
     *
     * @param callback unit of work
     * @param <T> callback result type
     * @return the callback's result
     */
    <T> T inTransaction(TransactionCallback<T> callback);
}
