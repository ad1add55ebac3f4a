package com.phillippitts.autoremediation.service.incident;

import com.phillippitts.autoremediation.domain.Finding;
import com.phillippitts.autoremediation.domain.Incident;
import com.phillippitts.autoremediation.domain.IncidentStatus;
import com.phillippitts.autoremediation.domain.RemediationSettings;
import com.phillippitts.autoremediation.domain.Severity;
import com.phillippitts.autoremediation.service.metrics.RemediationMetrics;
import com.phillippitts.autoremediation.service.notification.NotificationEvent;
import com.phillippitts.autoremediation.service.notification.NotificationEventType;
import com.phillippitts.autoremediation.service.store.RemediationStateStore;
import com.phillippitts.autoremediation.service.store.StoreTransaction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns findings into deduplicated incidents and drives their lifecycle
 * (ACTIVE to RESOLVED or ESCALATED).
 *
 * <p>A finding for a {@code (service, kind)} that already has an ACTIVE incident is merged into it:
 * evidence is overwritten key by key and severity only goes up. For {@code cooldown} after an
 * escalation, findings of the same pair merge into the escalated incident instead of opening a
 * new one. Every transition publishes a {@link NotificationEvent} once it has been committed.
 */
@Component
public class IncidentManager {

    private static final Logger LOG = LogManager.getLogger(IncidentManager.class);

    private final RemediationStateStore store;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;
    private final RemediationMetrics metrics;

    public IncidentManager(RemediationStateStore store,
                           Clock clock,
                           ApplicationEventPublisher publisher,
                           RemediationMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Records a finding.
     *
     * @param finding detector output
     * @param settings current settings snapshot; its cooldown is the escalation quiet period
     * @return the created or updated incident
     * @throws com.phillippitts.autoremediation.exception.PersistenceException if the store rejects the write
     */
    public Incident record(Finding finding, RemediationSettings settings) {
        Objects.requireNonNull(finding, "finding");
        return store.inTransaction(tx -> {
            Instant now = clock.instant();
            Optional<Incident> active = store.findActiveIncident(finding.service(), finding.kind());
            if (active.isPresent()) {
                return mergeInto(tx, active.get(), finding, now);
            }
            Optional<Incident> escalated = store.findLatestEscalated(finding.service(), finding.kind());
            if (escalated.isPresent() && inQuietPeriod(escalated.get(), now, settings)) {
                LOG.debug("Finding {} on {} merged into escalated incident {}",
                        finding.kind().code(), finding.service(), escalated.get().id());
                return mergeInto(tx, escalated.get(), finding, now);
            }
            Incident created = tx.insertIncident(Incident.open(finding, now));
            tx.afterCommit(() -> {
                LOG.warn("Incident {} opened on {}: {} ({})", created.id(), created.service(),
                        created.kind().code(), created.severity());
                publisher.publishEvent(event(NotificationEventType.INCIDENT_CREATED, created,
                        "New incident on " + created.service() + ": " + created.kind().code()
                                + " (" + created.severity() + ")", now));
            });
            return created;
        });
    }

    /**
     * Resolves an incident in its own transaction.
     *
     * @throws IllegalArgumentException if no incident has that id
     */
    public Incident resolve(long incidentId) {
        return store.inTransaction(tx -> resolve(tx, requireIncident(incidentId)));
    }

    /**
     * Resolves an ACTIVE or ESCALATED incident inside the caller's transaction. Already resolved
     * incidents are returned unchanged.
     */
    public Incident resolve(StoreTransaction tx, Incident incident) {
        Incident latest = store.findIncident(incident.id()).orElse(incident);
        if (latest.status() == IncidentStatus.RESOLVED) {
            return latest;
        }
        Instant now = clock.instant();
        Incident resolved = latest.resolve(now);
        tx.updateIncident(resolved);
        tx.afterCommit(() -> {
            LOG.info("Incident {} on {} resolved after {}s", resolved.id(), resolved.service(),
                    resolved.resolutionDuration().toSeconds());
            publisher.publishEvent(event(NotificationEventType.INCIDENT_RESOLVED, resolved,
                    "Incident " + resolved.id() + " on " + resolved.service() + " resolved ("
                            + resolved.kind().code() + ")", now));
        });
        return resolved;
    }

    /**
     * Escalates an incident in its own transaction.
     *
     * @throws IllegalArgumentException if no incident has that id
     */
    public Incident escalate(long incidentId, String reason) {
        return store.inTransaction(tx -> escalate(tx, requireIncident(incidentId), reason));
    }

    /**
     * Escalates an ACTIVE incident inside the caller's transaction. Incidents that are no longer
     * ACTIVE are returned unchanged.
     */
    public Incident escalate(StoreTransaction tx, Incident incident, String reason) {
        Incident latest = store.findIncident(incident.id()).orElse(incident);
        if (!latest.isActive()) {
            return latest;
        }
        Instant now = clock.instant();
        Incident escalated = latest.escalate(reason, now);
        tx.updateIncident(escalated);
        tx.afterCommit(() -> {
            metrics.recordEscalation(escalated.service());
            LOG.error("Incident {} on {} escalated: {}", escalated.id(), escalated.service(), reason);
            publisher.publishEvent(event(NotificationEventType.INCIDENT_ESCALATED, escalated,
                    "Incident " + escalated.id() + " on " + escalated.service() + " escalated: " + reason, now));
        });
        return escalated;
    }

    private Incident mergeInto(StoreTransaction tx, Incident existing, Finding finding, Instant now) {
        Incident merged = existing.merge(finding, now);
        tx.updateIncident(merged);
        if (merged.severity().isHigherThan(existing.severity())) {
            tx.afterCommit(() -> LOG.warn("Incident {} on {} upgraded {} -> {}", merged.id(), merged.service(),
                    existing.severity(), merged.severity()));
        }
        return merged;
    }

    private static boolean inQuietPeriod(Incident escalated, Instant now, RemediationSettings settings) {
        Instant at = escalated.escalatedAt();
        return at != null && !now.isAfter(at.plus(settings.limits().cooldown()));
    }

    private Incident requireIncident(long incidentId) {
        return store.findIncident(incidentId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown incident id: " + incidentId));
    }

    private static NotificationEvent event(NotificationEventType type, Incident incident, String message,
                                           Instant at) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("incident_uuid", incident.uuid().toString());
        details.put("kind", incident.kind().code());
        details.put("status", incident.status().name());
        if (incident.escalationReason() != null) {
            details.put("reason", incident.escalationReason());
        }
        details.putAll(incident.details());
        Severity severity = switch (type) {
            case INCIDENT_RESOLVED -> Severity.INFO;
            case INCIDENT_ESCALATED -> Severity.CRITICAL;
            default -> incident.severity();
        };
        return new NotificationEvent(type, incident.service(), severity, message, incident.id(), details, at);
    }
}
