package com.phillippitts.autoremediation.service.notification;

import com.phillippitts.autoremediation.domain.Severity;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Application event published after a state change has been committed. The
 * {@link NotificationDispatcher} forwards it to every enabled sink.
 *
 * @param type event type
 * @param service affected service
 * @param severity severity used for formatting and log level
 * @param message one-line human readable summary
 * @param incidentId related incident, or {@code null}
 * @param details extra key/value pairs for rich sinks
 * @param at when the state change happened
 */
public record NotificationEvent(
        NotificationEventType type,
        String service,
        Severity severity,
        String message,
        Long incidentId,
        Map<String, Object> details,
        Instant at
) {
    public NotificationEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(at, "at");
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
