package com.phillippitts.autoremediation.domain;

import com.phillippitts.autoremediation.exception.UnknownActionTypeException;

import java.util.Locale;

/**
 * Concrete recovery operations. {@link #MANUAL} records an operator intervention and never
 * reaches the lifecycle provider.
 */
public enum ActionType {
    RESTART_CONTAINER("restart_container"),
    SCALE_UP("scale_up"),
    SCALE_DOWN("scale_down"),
    HEAL("heal"),
    MANUAL("manual");

    private final String code;

    ActionType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Parses an action from its code ({@code scale_up}, {@code scale-up}) or enum name.
     *
     * @throws UnknownActionTypeException if the code names no action
     */
    public static ActionType fromCode(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            for (ActionType type : values()) {
                if (type.code.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new UnknownActionTypeException(value);
    }
}
