package com.phillippitts.autoremediation.service.notification;

/**
 * Events delivered to notification sinks.
 */
public enum NotificationEventType {
    INCIDENT_CREATED("incident_created"),
    INCIDENT_RESOLVED("incident_resolved"),
    INCIDENT_ESCALATED("incident_escalated"),
    REMEDIATION_STARTED("remediation_started"),
    REMEDIATION_SUCCEEDED("remediation_succeeded"),
    REMEDIATION_FAILED("remediation_failed"),
    CIRCUIT_OPENED("circuit_opened");

    private final String code;

    NotificationEventType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
