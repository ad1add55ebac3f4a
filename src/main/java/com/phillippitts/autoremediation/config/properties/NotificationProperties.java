package com.phillippitts.autoremediation.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Notification channel settings.
 */
@Validated
@ConfigurationProperties(prefix = "remediation.notifications")
public class NotificationProperties {

    private boolean consoleEnabled = true;

    /** Slack incoming webhook; blank disables the Slack channel. */
    private String slackWebhookUrl = "";

    private String username = "Auto-Remediation Bot";

    @Positive(message = "Request timeout must be positive")
    private long requestTimeoutMs = 5000;

    /** Drop repeats of the same event type for a service within this period; 0 disables. */
    @Min(0)
    private long throttleSeconds = 0;

    public boolean isConsoleEnabled() {
        return consoleEnabled;
    }

    public void setConsoleEnabled(boolean consoleEnabled) {
        this.consoleEnabled = consoleEnabled;
    }

    public String getSlackWebhookUrl() {
        return slackWebhookUrl;
    }

    public void setSlackWebhookUrl(String slackWebhookUrl) {
        this.slackWebhookUrl = slackWebhookUrl;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public long getThrottleSeconds() {
        return throttleSeconds;
    }

    public void setThrottleSeconds(long throttleSeconds) {
        this.throttleSeconds = throttleSeconds;
    }
}
