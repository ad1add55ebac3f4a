package com.phillippitts.autoremediation.exception;

/**
 * Thrown by a lifecycle provider when a restart, scale or health call against a target fails.
 */
public class LifecycleException extends AutoRemediationException {

    private final String target;

    public LifecycleException(String message, String target) {
        super(message + " (target: " + target + ")");
        this.target = target;
    }

    public LifecycleException(String message, String target, Throwable cause) {
        super(message + " (target: " + target + ")", cause);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
