package com.phillippitts.autoremediation.exception;

/**
 * Thrown when a configured action code does not name a known action type.
 * Fatal only to the incident being planned.
 */
public class UnknownActionTypeException extends AutoRemediationException {

    private final String code;

    public UnknownActionTypeException(String code) {
        super("Unknown action type: '" + code + "'");
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
