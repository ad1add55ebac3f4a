package com.phillippitts.autoremediation.service.orchestration;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Marks services whose tick work is still running.
 *
 * <p>Not a {@link java.util.concurrent.locks.Lock}: the scheduler thread acquires and the worker
 * thread that processed the service releases.
 */
@Component
public class ServiceLocks {

    private final Set<String> busy = ConcurrentHashMap.newKeySet();

    /** @return true if the caller now owns the service until {@link #release} */
    public boolean tryAcquire(String service) {
        return busy.add(service);
    }

    public void release(String service) {
        busy.remove(service);
    }

    public boolean isBusy(String service) {
        return busy.contains(service);
    }
}
