package com.phillippitts.autoremediation.exception;

/**
 * Thrown when the state store cannot read or durably write incidents, actions, breaker state
 * or action-window entries.
 *
 * <p>Processing of the affected incident stops for the current tick; the next tick retries.
 */
public class PersistenceException extends AutoRemediationException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
