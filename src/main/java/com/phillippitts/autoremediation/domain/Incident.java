package com.phillippitts.autoremediation.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Deduplicated, lifecycle-tracked record of a problem on one service.
 *
 * <p>Immutable; every transition returns a new instance that the state store persists.
 * An id of {@code 0} means the incident has not been stored yet.
 */
public record Incident(
        long id,
        UUID uuid,
        String service,
        FindingKind kind,
        Severity severity,
        IncidentStatus status,
        Map<String, Object> details,
        Instant createdAt,
        Instant updatedAt,
        Instant resolvedAt,
        Duration resolutionDuration,
        Instant escalatedAt,
        String escalationReason
) {
    public Incident {
        Objects.requireNonNull(uuid, "uuid");
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(createdAt, "createdAt");
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * Opens a new ACTIVE incident from a finding.
     */
    public static Incident open(Finding finding, Instant now) {
        return new Incident(0L, UUID.randomUUID(), finding.service(), finding.kind(), finding.severity(),
                IncidentStatus.ACTIVE, finding.evidence(), now, now, null, null, null, null);
    }

    public boolean isActive() {
        return status == IncidentStatus.ACTIVE;
    }

    public Incident withId(long newId) {
        return new Incident(newId, uuid, service, kind, severity, status, details, createdAt, updatedAt,
                resolvedAt, resolutionDuration, escalatedAt, escalationReason);
    }

    /**
     * Merges a repeated finding: evidence keys are overwritten, severity only ever goes up.
     */
    public Incident merge(Finding finding, Instant now) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.putAll(finding.evidence());
        return new Incident(id, uuid, service, kind, Severity.max(severity, finding.severity()), status, merged,
                createdAt, now, resolvedAt, resolutionDuration, escalatedAt, escalationReason);
    }

    public Incident resolve(Instant now) {
        return new Incident(id, uuid, service, kind, severity, IncidentStatus.RESOLVED, details, createdAt, now,
                now, Duration.between(createdAt, now), escalatedAt, escalationReason);
    }

    public Incident escalate(String reason, Instant now) {
        return new Incident(id, uuid, service, kind, severity, IncidentStatus.ESCALATED, details, createdAt, now,
                resolvedAt, resolutionDuration, now, reason);
    }
}
