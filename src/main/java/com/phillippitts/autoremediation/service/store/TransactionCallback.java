package com.phillippitts.autoremediation.service.store;

/**
 * Unit of work executed by {@link RemediationStateStore#inTransaction}.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface TransactionCallback<T> {

    T doInTransaction(StoreTransaction tx);
}
