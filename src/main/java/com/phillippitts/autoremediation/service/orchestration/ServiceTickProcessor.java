package com.phillippitts.autoremediation.service.orchestration;

import com.phillippitts.autoremediation.domain.Finding;
import com.phillippitts.autoremediation.domain.Incident;
import com.phillippitts.autoremediation.domain.IncidentStatus;
import com.phillippitts.autoremediation.domain.MetricsSnapshot;
import com.phillippitts.autoremediation.domain.RemediationAction;
import com.phillippitts.autoremediation.domain.RemediationSettings;
import com.phillippitts.autoremediation.service.advisory.AdvisoryInbox;
import com.phillippitts.autoremediation.service.detect.DetectorChain;
import com.phillippitts.autoremediation.service.detect.SnapshotHistory;
import com.phillippitts.autoremediation.service.incident.IncidentManager;
import com.phillippitts.autoremediation.service.metrics.RemediationMetrics;
import com.phillippitts.autoremediation.service.remediation.AttemptOutcome;
import com.phillippitts.autoremediation.service.remediation.AutomaticRemediationService;
import com.phillippitts.autoremediation.service.snapshot.SnapshotCollector;
import com.phillippitts.autoremediation.service.store.RemediationStateStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One service's share of a tick: snapshot, detection, incident bookkeeping and automatic
 * attempts for the service's ACTIVE incidents.
 *
 * <p>A service whose snapshot could not even be requested (own pool saturated) is skipped for the
 * tick: no detection, no attempts. Failures are contained: a finding that cannot be recorded is skipped, and an incident whose
 * processing throws (persistence failure, unknown action code) is left for the next tick while
 * the remaining incidents are still processed.
 */
@Component
public class ServiceTickProcessor {

    private static final Logger LOG = LogManager.getLogger(ServiceTickProcessor.class);

    private final SnapshotCollector collector;
    private final SnapshotHistory history;
    private final DetectorChain detectors;
    private final AdvisoryInbox advisories;
    private final IncidentManager incidents;
    private final AutomaticRemediationService remediation;
    private final RemediationStateStore store;
    private final RemediationMetrics metrics;
    private final Clock clock;

    public ServiceTickProcessor(SnapshotCollector collector,
                                SnapshotHistory history,
                                DetectorChain detectors,
                                AdvisoryInbox advisories,
                                IncidentManager incidents,
                                AutomaticRemediationService remediation,
                                RemediationStateStore store,
                                RemediationMetrics metrics,
                                Clock clock) {
        this.collector = Objects.requireNonNull(collector, "collector");
        this.history = Objects.requireNonNull(history, "history");
        this.detectors = Objects.requireNonNull(detectors, "detectors");
        this.advisories = Objects.requireNonNull(advisories, "advisories");
        this.incidents = Objects.requireNonNull(incidents, "incidents");
        this.remediation = Objects.requireNonNull(remediation, "remediation");
        this.store = Objects.requireNonNull(store, "store");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public TickReport process(String service, RemediationSettings settings, long tick) {
        ThreadContext.put("service", service);
        ThreadContext.put("tick", Long.toString(tick));
        try {
            Optional<MetricsSnapshot> collected = collector.collect(service, settings.snapshotTimeout());
            if (collected.isEmpty()) {
                LOG.warn("Tick {}: no snapshot taken for {}; service skipped", tick, service);
                return TickReport.skipped(service, tick);
            }
            MetricsSnapshot snapshot = collected.get();
            List<MetricsSnapshot> previous = history.recent(service);
            history.record(snapshot, settings.historySize());

            List<Finding> findings = new ArrayList<>(detectors.evaluate(snapshot, previous, settings.thresholds()));
            findings.addAll(advisories.drain(service));

            List<Finding> recorded = new ArrayList<>();
            for (Finding finding : findings) {
                metrics.recordDetection(finding.kind());
                LOG.warn("{} on {} ({}): {}", finding.kind().code(), service, finding.severity(), finding.evidence());
                try {
                    incidents.record(finding, settings);
                    recorded.add(finding);
                } catch (RuntimeException e) {
                    LOG.error("Could not record {} finding for {}: {}", finding.kind().code(), service,
                            e.getMessage(), e);
                }
            }

            Map<Long, AttemptOutcome> attempts = new LinkedHashMap<>();
            for (Incident incident : store.findIncidentsByStatus(service, IncidentStatus.ACTIVE)) {
                if (attemptedRecently(incident, settings)) {
                    LOG.debug("Incident {} attempted within the last {}s; waiting", incident.id(),
                            settings.minAttemptInterval().toSeconds());
                    continue;
                }
                ThreadContext.put("incidentId", Long.toString(incident.id()));
                try {
                    attempts.put(incident.id(), remediation.attempt(incident, settings));
                } catch (RuntimeException e) {
                    LOG.error("Processing incident {} on {} failed; retrying next tick: {}", incident.id(), service,
                            e.getMessage(), e);
                } finally {
                    ThreadContext.remove("incidentId");
                }
            }
            return new TickReport(service, tick, recorded, attempts, false);
        } finally {
            ThreadContext.remove("service");
            ThreadContext.remove("tick");
        }
    }

    private boolean attemptedRecently(Incident incident, RemediationSettings settings) {
        Optional<Instant> last = store.findActions(incident.id()).stream()
                .map(RemediationAction::createdAt)
                .max(Instant::compareTo);
        return last.isPresent()
                && clock.instant().isBefore(last.get().plus(settings.minAttemptInterval()));
    }
}
