package com.phillippitts.autoremediation.service.detect;

import com.phillippitts.autoremediation.domain.Finding;
import com.phillippitts.autoremediation.domain.MetricsSnapshot;
import com.phillippitts.autoremediation.domain.RemediationSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs every registered {@link Detector} against a snapshot. A detector that throws is logged
 * and skipped; the others still run.
 */
@Component
public class DetectorChain {

    private static final Logger LOG = LogManager.getLogger(DetectorChain.class);

    private final List<Detector> detectors;

    public DetectorChain(List<Detector> detectors) {
        this.detectors = List.copyOf(detectors);
        LOG.info("Detectors registered: {}", this.detectors.stream().map(d -> d.kind().code()).toList());
    }

    public List<Finding> evaluate(MetricsSnapshot snapshot,
                                  List<MetricsSnapshot> history,
                                  RemediationSettings.Thresholds thresholds) {
        List<Finding> findings = new ArrayList<>();
        for (Detector detector : detectors) {
            try {
                Optional<Finding> finding = detector.evaluate(snapshot, history, thresholds);
                finding.ifPresent(findings::add);
            } catch (RuntimeException e) {
                LOG.error("Detector {} failed for {}: {}", detector.kind().code(), snapshot.service(),
                        e.toString(), e);
            }
        }
        return findings;
    }
}
