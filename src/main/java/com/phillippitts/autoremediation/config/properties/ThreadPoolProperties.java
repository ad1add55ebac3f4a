package com.phillippitts.autoremediation.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Three bounded pools: per-service tick work, lifecycle provider calls (so a stuck call can be
 * cancelled without holding a monitor thread) and notification delivery.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PoolProperties monitor = new PoolProperties(2, 4, 16, "monitor-pool-");
    private PoolProperties lifecycle = new PoolProperties(2, 4, 8, "lifecycle-pool-");
    private PoolProperties notification = new PoolProperties(1, 2, 100, "notify-pool-");

    public PoolProperties getMonitor() {
        return monitor;
    }

    public void setMonitor(PoolProperties monitor) {
        this.monitor = monitor;
    }

    public PoolProperties getLifecycle() {
        return lifecycle;
    }

    public void setLifecycle(PoolProperties lifecycle) {
        this.lifecycle = lifecycle;
    }

    public PoolProperties getNotification() {
        return notification;
    }

    public void setNotification(PoolProperties notification) {
        this.notification = notification;
    }

    /**
     * Sizing for one pool.
     */
    public static class PoolProperties {
        private int corePoolSize;
        private int maxPoolSize;
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public PoolProperties() {
            this(1, 1, 10, "pool-");
        }

        PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
