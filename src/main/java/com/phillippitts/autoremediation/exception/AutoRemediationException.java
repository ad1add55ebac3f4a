package com.phillippitts.autoremediation.exception;

/**
 * Base exception for all auto-remediation errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class AutoRemediationException extends RuntimeException {

    public AutoRemediationException(String message) {
        super(message);
    }

    public AutoRemediationException(String message, Throwable cause) {
        super(message, cause);
    }

    public AutoRemediationException(Throwable cause) {
        super(cause);
    }
}
