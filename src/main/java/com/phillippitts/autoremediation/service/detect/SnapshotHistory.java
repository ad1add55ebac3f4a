package com.phillippitts.autoremediation.service.detect;

import com.phillippitts.autoremediation.domain.MetricsSnapshot;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Bounded per-service history of recent snapshots, oldest first.
 */
@Component
public class SnapshotHistory {

    private final ConcurrentMap<String, Deque<MetricsSnapshot>> byService = new ConcurrentHashMap<>();

    /** Copy of the retained snapshots for a service. */
    public List<MetricsSnapshot> recent(String service) {
        Deque<MetricsSnapshot> deque = byService.get(service);
        if (deque == null) {
            return List.of();
        }
        synchronized (deque) {
            return List.copyOf(deque);
        }
    }

    /** Appends a snapshot and drops the oldest ones beyond {@code capacity}. */
    public void record(MetricsSnapshot snapshot, int capacity) {
        Deque<MetricsSnapshot> deque = byService.computeIfAbsent(snapshot.service(), s -> new ArrayDeque<>());
        synchronized (deque) {
            deque.addLast(snapshot);
            while (deque.size() > Math.max(capacity, 1)) {
                deque.removeFirst();
            }
        }
    }
}
