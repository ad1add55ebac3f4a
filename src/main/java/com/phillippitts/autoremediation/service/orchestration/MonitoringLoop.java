package com.phillippitts.autoremediation.service.orchestration;

import com.phillippitts.autoremediation.config.settings.ConfigSource;
import com.phillippitts.autoremediation.domain.RemediationSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic driver. Each tick takes one settings snapshot and fans the monitored services out
 * onto the monitor pool; a service whose previous tick is still running is skipped rather than
 * queued behind it.
 */
@Component
@ConditionalOnProperty(prefix = "remediation.monitor", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MonitoringLoop {

    private static final Logger LOG = LogManager.getLogger(MonitoringLoop.class);

    private final ConfigSource configSource;
    private final ServiceTickProcessor processor;
    private final ServiceLocks locks;
    private final Executor executor;
    private final AtomicLong ticks = new AtomicLong();

    public MonitoringLoop(ConfigSource configSource,
                          ServiceTickProcessor processor,
                          ServiceLocks locks,
                          @Qualifier("monitorExecutor") Executor executor) {
        this.configSource = Objects.requireNonNull(configSource, "configSource");
        this.processor = Objects.requireNonNull(processor, "processor");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Scheduled(fixedRateString = "${remediation.monitor.tick-interval-ms:5000}")
    public void tick() {
        long tick = ticks.incrementAndGet();
        RemediationSettings settings;
        try {
            settings = configSource.current();
        } catch (RuntimeException e) {
            LOG.error("Tick {} skipped: settings unavailable: {}", tick, e.getMessage(), e);
            return;
        }
        for (String service : settings.services()) {
            dispatch(service, settings, tick);
        }
    }

    long tickCount() {
        return ticks.get();
    }

    private void dispatch(String service, RemediationSettings settings, long tick) {
        if (!locks.tryAcquire(service)) {
            LOG.debug("Tick {}: {} still processing previous tick; skipped", tick, service);
            return;
        }
        try {
            executor.execute(() -> {
                try {
                    processor.process(service, settings, tick);
                } catch (RuntimeException e) {
                    LOG.error("Tick {} for {} failed: {}", tick, service, e.getMessage(), e);
                } finally {
                    locks.release(service);
                }
            });
        } catch (RejectedExecutionException e) {
            locks.release(service);
            LOG.warn("Tick {}: monitor pool saturated; {} skipped", tick, service);
        }
    }
}
