package com.phillippitts.autoremediation.service.remediation;

/**
 * Outcome of one lifecycle provider call.
 *
 * @param success whether the operation took effect
 * @param detail provider output or error text, already shortened for logs
 */
public record LifecycleResult(boolean success, String detail) {

    public static LifecycleResult ok(String detail) {
        return new LifecycleResult(true, detail);
    }

    public static LifecycleResult failed(String detail) {
        return new LifecycleResult(false, detail);
    }
}
