package com.phillippitts.autoremediation.domain;

/**
 * Incident lifecycle. ACTIVE is the only non-terminal status.
 */
public enum IncidentStatus {
    ACTIVE,
    RESOLVED,
    ESCALATED
}
