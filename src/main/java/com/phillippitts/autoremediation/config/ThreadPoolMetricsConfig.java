package com.phillippitts.autoremediation.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes pool gauges via Micrometer, tagged {@code pool=monitor|lifecycle|notification}:
 * <ul>
 *   <li>monitor.pool.size - Current number of threads</li>
 *   <li>monitor.pool.active - Threads executing tasks</li>
 *   <li>monitor.pool.queued - Tasks waiting in the queue</li>
 *   <li>monitor.pool.completed - Cumulative completed tasks</li>
 * </ul>
 *
 * <p>Additionally logs a health summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> monitorExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> lifecycleExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> notificationExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("monitorExecutor") ObjectProvider<ThreadPoolTaskExecutor> monitorExecutorProvider,
            @Qualifier("lifecycleExecutor") ObjectProvider<ThreadPoolTaskExecutor> lifecycleExecutorProvider,
            @Qualifier("notificationExecutor") ObjectProvider<ThreadPoolTaskExecutor> notificationExecutorProvider) {
        this.monitorExecutorProvider = monitorExecutorProvider;
        this.lifecycleExecutorProvider = lifecycleExecutorProvider;
        this.notificationExecutorProvider = notificationExecutorProvider;
    }

    @Bean
    public MeterBinder remediationPoolMetrics() {
        return registry -> {
            bind(registry, "monitor", monitorExecutorProvider.getObject().getThreadPoolExecutor());
            bind(registry, "lifecycle", lifecycleExecutorProvider.getObject().getThreadPoolExecutor());
            bind(registry, "notification", notificationExecutorProvider.getObject().getThreadPoolExecutor());
            LOG.info("Thread pool metrics registered: monitor.pool.* available via /actuator/metrics");
        };
    }

    static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Tags tags = Tags.of("pool", pool);
        Gauge.builder("monitor.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .tags(tags)
                .register(registry);
        Gauge.builder("monitor.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .tags(tags)
                .register(registry);
        Gauge.builder("monitor.pool.queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting in the queue")
                .tags(tags)
                .register(registry);
        Gauge.builder("monitor.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed tasks")
                .tags(tags)
                .register(registry);
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        log("monitor", monitorExecutorProvider.getObject().getThreadPoolExecutor());
        log("lifecycle", lifecycleExecutorProvider.getObject().getThreadPoolExecutor());
    }

    private static void log(String pool, ThreadPoolExecutor executor) {
        LOG.info("{} pool health: size={}/{}, active={}, queued={}, completed={}",
                pool,
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
