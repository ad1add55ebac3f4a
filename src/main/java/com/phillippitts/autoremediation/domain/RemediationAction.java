package com.phillippitts.autoremediation.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only audit record of one remediation attempt, written whether it succeeded or not.
 */
public record RemediationAction(
        long id,
        UUID uuid,
        long incidentId,
        String service,
        ActionType actionType,
        String target,
        boolean success,
        String error,
        Duration executionTime,
        String triggeredBy,
        Instant createdAt
) {
    public static final String TRIGGERED_BY_BOT = "bot";

    public RemediationAction {
        Objects.requireNonNull(uuid, "uuid");
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(actionType, "actionType");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(createdAt, "createdAt");
        if (executionTime == null) {
            executionTime = Duration.ZERO;
        }
        if (triggeredBy == null || triggeredBy.isBlank()) {
            triggeredBy = TRIGGERED_BY_BOT;
        }
    }

    public RemediationAction withId(long newId) {
        return new RemediationAction(newId, uuid, incidentId, service, actionType, target, success, error,
                executionTime, triggeredBy, createdAt);
    }
}
