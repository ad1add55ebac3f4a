package com.phillippitts.autoremediation.service.remediation;

import java.time.Duration;

/**
 * Container/process lifecycle operations. Every call must be safe to repeat.
 *
 * <p>{@code timeout} is the caller's bound on the whole call. Implementations that start external
 * work bound it by the same value, and stop promptly when interrupted: callers interrupt a call
 * that overruns.
 */
public interface LifecycleProvider {

    LifecycleResult restart(String target, Duration timeout);

    /**
     * Changes the replica count of {@code target} by {@code delta}; the count never drops below zero.
     */
    LifecycleResult scale(String target, int delta, Duration timeout);

    /** Reports {@code success=true} when the target is running. */
    LifecycleResult health(String target, Duration timeout);
}
