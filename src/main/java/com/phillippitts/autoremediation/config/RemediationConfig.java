package com.phillippitts.autoremediation.config;

import com.phillippitts.autoremediation.config.properties.MonitorProperties;
import com.phillippitts.autoremediation.config.properties.NotificationProperties;
import com.phillippitts.autoremediation.config.properties.OverlayProperties;
import com.phillippitts.autoremediation.config.properties.RemediationProperties;
import com.phillippitts.autoremediation.config.properties.ThresholdProperties;
import com.phillippitts.autoremediation.config.settings.ConfigSource;
import com.phillippitts.autoremediation.config.settings.OverlayConfigSource;
import com.phillippitts.autoremediation.config.settings.PropertiesConfigSource;
import com.phillippitts.autoremediation.service.notification.HttpClientWebhookTransport;
import com.phillippitts.autoremediation.service.notification.SlackWebhookNotificationSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the clock, the settings source and the optional Slack channel.
 */
@Configuration
public class RemediationConfig {

    private static final Logger LOG = LogManager.getLogger(RemediationConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Property-backed settings, overlaid with {@code remediation.config.overlay-file} when set.
     */
    @Bean
    public ConfigSource configSource(MonitorProperties monitor,
                                     ThresholdProperties thresholds,
                                     RemediationProperties policy,
                                     OverlayProperties overlay) {
        ConfigSource base = new PropertiesConfigSource(monitor, thresholds, policy);
        String file = overlay.getOverlayFile();
        if (file == null || file.isBlank()) {
            return base;
        }
        LOG.info("Settings overlay enabled: {}", file);
        return new OverlayConfigSource(base, Path.of(file));
    }

    @Bean
    @ConditionalOnExpression("'${remediation.notifications.slack-webhook-url:}' != ''")
    public SlackWebhookNotificationSink slackNotificationSink(NotificationProperties props) {
        LOG.info("Slack notifications enabled");
        return new SlackWebhookNotificationSink(
                URI.create(props.getSlackWebhookUrl().trim()),
                props.getUsername(),
                new HttpClientWebhookTransport(Duration.ofMillis(props.getRequestTimeoutMs())));
    }
}
