package com.phillippitts.autoremediation.service.advisory;

import com.phillippitts.autoremediation.domain.AdvisorySignal;
import com.phillippitts.autoremediation.domain.Finding;
import com.phillippitts.autoremediation.domain.FindingKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Collects signals from external advisors (anomaly detection, failure prediction, forecasts)
 * until the next tick turns them into {@code external_advisory} findings.
 *
 * <p>Each service's queue is bounded; when it is full the oldest signal is dropped.
 */
@Component
public class AdvisoryInbox {

    private static final Logger LOG = LogManager.getLogger(AdvisoryInbox.class);

    static final int CAPACITY_PER_SERVICE = 64;

    private final ConcurrentMap<String, BlockingQueue<AdvisorySignal>> queues = new ConcurrentHashMap<>();

    public void submit(String service, AdvisorySignal signal) {
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(signal, "signal");
        BlockingQueue<AdvisorySignal> queue =
                queues.computeIfAbsent(service, s -> new ArrayBlockingQueue<>(CAPACITY_PER_SERVICE));
        while (!queue.offer(signal)) {
            AdvisorySignal dropped = queue.poll();
            if (dropped != null) {
                LOG.warn("Advisory inbox full for {}; dropped signal from {}", service, dropped.source());
            }
        }
        LOG.debug("Advisory queued for {} from {} ({})", service, signal.source(), signal.severity());
    }

    /**
     * Removes all pending signals for a service and returns them as findings, in arrival order.
     */
    public List<Finding> drain(String service) {
        BlockingQueue<AdvisorySignal> queue = queues.get(service);
        if (queue == null) {
            return List.of();
        }
        List<AdvisorySignal> signals = new ArrayList<>();
        queue.drainTo(signals);
        List<Finding> findings = new ArrayList<>(signals.size());
        for (AdvisorySignal signal : signals) {
            Map<String, Object> evidence = new LinkedHashMap<>(signal.evidence());
            evidence.put("source", signal.source());
            if (signal.message() != null) {
                evidence.put("message", signal.message());
            }
            findings.add(new Finding(service, FindingKind.EXTERNAL_ADVISORY, signal.severity(), evidence,
                    signal.at()));
        }
        return findings;
    }

    public int pending(String service) {
        BlockingQueue<AdvisorySignal> queue = queues.get(service);
        return queue == null ? 0 : queue.size();
    }
}
