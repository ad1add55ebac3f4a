package com.phillippitts.autoremediation.util;

/** Keeps provider output and error text short before it is logged, stored or sent out. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Collapses line breaks and control characters to single spaces, trims, then truncates.
     * Used for process output that ends up in a one-line log entry or an action's error field.
     */
    public static String singleLine(String s, int max) {
        if (s == null) {
            return "";
        }
        String collapsed = s.replaceAll("[\\p{Cntrl}\\s]+", " ").trim();
        return truncate(collapsed, max);
    }
}
