package com.phillippitts.autoremediation.exception;

/**
 * Thrown by a metrics snapshot provider when the monitored service cannot be read.
 * The snapshot collector turns it into an unreachable snapshot.
 */
public class SnapshotUnavailableException extends AutoRemediationException {

    private final String service;

    public SnapshotUnavailableException(String message, String service) {
        super(message);
        this.service = service;
    }

    public SnapshotUnavailableException(String message, String service, Throwable cause) {
        super(message, cause);
        this.service = service;
    }

    public String getService() {
        return service;
    }
}
