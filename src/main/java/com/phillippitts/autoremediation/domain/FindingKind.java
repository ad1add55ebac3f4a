package com.phillippitts.autoremediation.domain;

import java.util.Locale;

/**
 * Kind of problem a detector reports. The code is the stable identifier stored with incidents.
 */
public enum FindingKind {
    HEALTH_CHECK_FAILED("health_check_failed"),
    HIGH_ERROR_RATE("high_error_rate"),
    CPU_SPIKE("cpu_spike"),
    HIGH_RESPONSE_TIME("high_response_time"),
    MEMORY_LEAK("memory_leak"),
    EXTERNAL_ADVISORY("external_advisory");

    private final String code;

    FindingKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Parses a kind from its code ({@code cpu_spike}) or enum name ({@code CPU_SPIKE}).
     *
     * @throws IllegalArgumentException if the value matches no kind
     */
    public static FindingKind fromCode(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            for (FindingKind kind : values()) {
                if (kind.code.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown finding kind: '" + value + "'");
    }
}
