package com.phillippitts.autoremediation.service.notification;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Console channel: writes each event to the log at a level matching its severity.
 */
@Component
@ConditionalOnProperty(prefix = "remediation.notifications", name = "console-enabled",
        havingValue = "true", matchIfMissing = true)
public class LoggingNotificationSink implements NotificationSink {

    private static final Logger LOG = LogManager.getLogger(LoggingNotificationSink.class);

    @Override
    public String name() {
        return "console";
    }

    @Override
    public void send(NotificationEvent event) {
        Level level = switch (event.severity()) {
            case CRITICAL -> Level.ERROR;
            case WARNING -> Level.WARN;
            case INFO -> Level.INFO;
        };
        if (event.details().isEmpty()) {
            LOG.log(level, "[NOTIFICATION] {}: {}", event.type().code(), event.message());
        } else {
            LOG.log(level, "[NOTIFICATION] {}: {} | {}", event.type().code(), event.message(), event.details());
        }
    }
}
