package com.phillippitts.autoremediation.service.notification;

import com.phillippitts.autoremediation.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.util.Objects;

/**
 * Slack incoming-webhook channel. Payload: {@code {text, username, icon_emoji}}, where the text
 * starts with an emoji and the severity, followed by the details as a code block.
 */
public class SlackWebhookNotificationSink implements NotificationSink {

    private static final Logger LOG = LogManager.getLogger(SlackWebhookNotificationSink.class);

    static final String ICON_EMOJI = ":robot_face:";
    private static final int MAX_DETAILS_CHARS = 1500;

    private final URI webhookUri;
    private final String username;
    private final WebhookTransport transport;

    public SlackWebhookNotificationSink(URI webhookUri, String username, WebhookTransport transport) {
        this.webhookUri = Objects.requireNonNull(webhookUri, "webhookUri");
        this.username = Objects.requireNonNull(username, "username");
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    @Override
    public String name() {
        return "slack";
    }

    @Override
    public void send(NotificationEvent event) throws IOException {
        transport.post(webhookUri, payload(event));
        LOG.debug("Slack notification sent: {}", event.type().code());
    }

    // Package-private for tests
    String payload(NotificationEvent event) {
        String label = isSuccess(event) ? "SUCCESS" : event.severity().name();
        StringBuilder text = new StringBuilder()
                .append(emoji(event)).append(" *").append(label).append("* - ").append(event.message());
        if (!event.details().isEmpty()) {
            text.append("\n```")
                    .append(LogSanitizer.truncate(new JSONObject(event.details()).toString(), MAX_DETAILS_CHARS))
                    .append("```");
        }
        return new JSONObject()
                .put("text", text.toString())
                .put("username", username)
                .put("icon_emoji", ICON_EMOJI)
                .toString();
    }

    private static boolean isSuccess(NotificationEvent event) {
        return event.type() == NotificationEventType.REMEDIATION_SUCCEEDED
                || event.type() == NotificationEventType.INCIDENT_RESOLVED;
    }

    private static String emoji(NotificationEvent event) {
        if (isSuccess(event)) {
            return ":white_check_mark:";
        }
        return switch (event.severity()) {
            case CRITICAL -> ":red_circle:";
            case WARNING -> ":warning:";
            case INFO -> ":information_source:";
        };
    }
}
