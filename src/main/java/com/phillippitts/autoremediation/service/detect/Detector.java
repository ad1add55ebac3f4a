package com.phillippitts.autoremediation.service.detect;

import com.phillippitts.autoremediation.domain.Finding;
import com.phillippitts.autoremediation.domain.FindingKind;
import com.phillippitts.autoremediation.domain.MetricsSnapshot;
import com.phillippitts.autoremediation.domain.RemediationSettings;

import java.util.List;
import java.util.Optional;

/**
 * Compares one snapshot, and optionally recent history, against thresholds.
 *
 * <p>Implementations are pure: no I/O, no shared mutable state, same inputs give the same output.
 */
public interface Detector {

    /** Kind of finding this detector produces. */
    FindingKind kind();

    /**
     * @param snapshot current reading
     * @param history earlier readings for the same service, oldest first, not including {@code snapshot}
     * @param thresholds thresholds from the current settings snapshot
     * @return a finding when a threshold is breached
     */
    Optional<Finding> evaluate(MetricsSnapshot snapshot,
                               List<MetricsSnapshot> history,
                               RemediationSettings.Thresholds thresholds);
}
