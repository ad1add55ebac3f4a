package com.phillippitts.autoremediation.config;

import com.phillippitts.autoremediation.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded thread pools for the monitoring loop.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} ({@code threadpool.*}).
 *
 * <p>All three pools use {@link ThreadPoolExecutor.AbortPolicy}: callers catch the rejection and
 * degrade (service skipped this tick, lifecycle call recorded as failed, notification dropped
 * with a log line). Running the task on the caller instead would block the scheduler thread.
 *
 * <p>MDC propagation: each pool copies the Log4j2 ThreadContext of the submitting thread to
 * the worker, so {@code service}, {@code tick} and {@code incidentId} appear in async logs.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Per-service tick work. Sized for the number of monitored services.
     */
    @Bean(name = "monitorExecutor")
    public ThreadPoolTaskExecutor monitorExecutor() {
        return build(threadPoolProperties.getMonitor());
    }

    /**
     * Snapshot fetches and lifecycle provider calls. Kept apart from the monitor pool so a call
     * can be abandoned on timeout without holding a monitor thread.
     */
    @Bean(name = "lifecycleExecutor")
    public ThreadPoolTaskExecutor lifecycleExecutor() {
        return build(threadPoolProperties.getLifecycle());
    }

    /**
     * Notification delivery (console, Slack).
     */
    @Bean(name = "notificationExecutor")
    public ThreadPoolTaskExecutor notificationExecutor() {
        return build(threadPoolProperties.getNotification());
    }

    static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    ThreadContext.clearAll();
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
