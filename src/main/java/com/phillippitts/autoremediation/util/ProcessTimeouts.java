package com.phillippitts.autoremediation.util;

import java.time.Duration;

/**
 * Timeouts for lifecycle command processes.
 *
 * <p>The overall bound on a lifecycle call comes from {@code remediation.policy.lifecycle-timeout-ms};
 * these values only cover cleanup once that bound has been hit.
 *
 * @see com.phillippitts.autoremediation.service.remediation.CommandLifecycleProvider
 */
public final class ProcessTimeouts {

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /** Maximum characters of process output kept for logs and action records. */
    public static final int MAX_OUTPUT_CHARS = 2000;

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
