package com.phillippitts.autoremediation.service.store;

import com.phillippitts.autoremediation.domain.ActionWindowEntry;
import com.phillippitts.autoremediation.domain.CircuitBreakerState;
import com.phillippitts.autoremediation.domain.Incident;
import com.phillippitts.autoremediation.domain.RemediationAction;

/**
 * Write side of a store transaction. Writes are staged and become visible together on commit.
 *
 * <p>Reads through the transaction see the transaction's own staged incidents and breaker
 * states on top of committed data.
 */
public interface StoreTransaction {

    /** Stages a new incident and returns it with its assigned id. */
    Incident insertIncident(Incident incident);

    void updateIncident(Incident incident);

    /** Stages a new action and returns it with its assigned id. */
    RemediationAction insertAction(RemediationAction action);

    void saveBreakerState(CircuitBreakerState state);

    void appendActionWindowEntry(ActionWindowEntry entry);

    /** Breaker state as this transaction currently sees it. */
    CircuitBreakerState breakerState(String service);

    /**
     * Registers a hook that runs once the transaction has committed. Hooks never run for a
     * rolled-back transaction; a failing hook is logged and does not affect the others.
     */
    void afterCommit(Runnable hook);
}
