package com.phillippitts.autoremediation.service.notification;

import java.io.IOException;

/**
 * Outbound channel for notification events. Called off the orchestration threads; a failure is
 * logged by the dispatcher and never reaches the caller that published the event.
 */
public interface NotificationSink {

    /** Short channel name for logs, e.g. {@code slack}. */
    String name();

    void send(NotificationEvent event) throws IOException;
}
