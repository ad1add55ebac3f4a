package com.phillippitts.autoremediation.service.snapshot;

import com.phillippitts.autoremediation.domain.MetricsSnapshot;

/**
 * Source of point-in-time readings for a monitored service.
 */
public interface MetricsSnapshotProvider {

    /**
     * Reads the service's current metrics. A service that answers with an error status is still
     * reachable; the status code is carried on the snapshot.
     *
     * @param service service name
     * @return snapshot
     * @throws com.phillippitts.autoremediation.exception.SnapshotUnavailableException if the
     *         service cannot be reached or its report cannot be parsed
     */
    MetricsSnapshot fetch(String service);
}
