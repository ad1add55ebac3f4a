package com.phillippitts.autoremediation.util;

import java.time.Duration;

/**
 * Helpers for measuring wall-clock execution time with {@link System#nanoTime()}.
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Elapsed time since a nanosecond timestamp, never negative.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     */
    public static Duration elapsedSince(long startNanos) {
        long nanos = System.nanoTime() - startNanos;
        return Duration.ofNanos(Math.max(0L, nanos));
    }
}
