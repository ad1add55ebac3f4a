package com.phillippitts.autoremediation.service.notification;

import com.phillippitts.autoremediation.config.properties.NotificationProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fans committed {@link NotificationEvent}s out to every registered sink on the notification pool.
 *
 * <p>Publishing never blocks on delivery. Sink failures and a saturated pool are logged only.
 * When {@code remediation.notifications.throttle-seconds} is positive, repeated events of the same
 * type for the same service within that period are dropped.
 */
@Component
public class NotificationDispatcher {

    private static final Logger LOG = LogManager.getLogger(NotificationDispatcher.class);

    private final List<NotificationSink> sinks;
    private final Executor executor;
    private final NotificationProperties props;
    private final Clock clock;

    private final Map<String, Instant> lastSent = new ConcurrentHashMap<>();

    public NotificationDispatcher(List<NotificationSink> sinks,
                                  @Qualifier("notificationExecutor") Executor executor,
                                  NotificationProperties props,
                                  Clock clock) {
        this.sinks = List.copyOf(sinks);
        this.executor = Objects.requireNonNull(executor, "executor");
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
        LOG.info("Notification sinks: {}", this.sinks.stream().map(NotificationSink::name).toList());
    }

    @EventListener
    public void onNotification(NotificationEvent event) {
        if (!shouldSend(event)) {
            LOG.debug("Notification throttled: type={}, service={}", event.type().code(), event.service());
            return;
        }
        for (NotificationSink sink : sinks) {
            try {
                executor.execute(() -> deliver(sink, event));
            } catch (RejectedExecutionException e) {
                LOG.warn("Notification pool saturated; dropped {} for sink {}", event.type().code(), sink.name());
            }
        }
    }

    void deliver(NotificationSink sink, NotificationEvent event) {
        try {
            sink.send(event);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Notification sink {} failed for {}: {}", sink.name(), event.type().code(), e.toString());
        }
    }

    // Package-private for tests
    boolean shouldSend(NotificationEvent event) {
        long throttleSeconds = props.getThrottleSeconds();
        if (throttleSeconds <= 0) {
            return true;
        }
        String key = event.type().code() + '|' + event.service();
        Instant now = clock.instant();
        Duration throttle = Duration.ofSeconds(throttleSeconds);
        boolean[] send = new boolean[1];
        lastSent.compute(key, (k, prev) -> {
            if (prev == null || Duration.between(prev, now).compareTo(throttle) >= 0) {
                send[0] = true;
                return now;
            }
            return prev;
        });
        return send[0];
    }
}
