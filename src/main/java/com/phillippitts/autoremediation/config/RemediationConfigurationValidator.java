package com.phillippitts.autoremediation.config;

import com.phillippitts.autoremediation.config.properties.MetricsSourceProperties;
import com.phillippitts.autoremediation.config.settings.ConfigSource;
import com.phillippitts.autoremediation.config.settings.SettingsChecks;
import com.phillippitts.autoremediation.domain.RemediationSettings;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Cross-field checks the annotations on the property classes cannot express. Fails fast at
 * startup with every problem listed.
 */
@Component
class RemediationConfigurationValidator {

    private final ConfigSource configSource;
    private final MetricsSourceProperties metricsSource;

    RemediationConfigurationValidator(ConfigSource configSource, MetricsSourceProperties metricsSource) {
        this.configSource = configSource;
        this.metricsSource = metricsSource;
    }

    @PostConstruct
    void validate() {
        RemediationSettings settings = configSource.current();
        List<String> problems = new ArrayList<>(SettingsChecks.problems(settings));
        for (String service : settings.services()) {
            String url = metricsSource.getBaseUrls().get(service);
            if (url == null || url.isBlank()) {
                problems.add("remediation.metrics-source.base-urls has no entry for monitored service '"
                        + service + "'");
            }
        }
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Invalid remediation configuration: " + String.join("; ", problems));
        }
    }
}
