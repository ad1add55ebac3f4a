package com.phillippitts.autoremediation.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Where to poll each monitored service's health report.
 */
@Validated
@ConfigurationProperties(prefix = "remediation.metrics-source")
public class MetricsSourceProperties {

    /** Service name to base URL. */
    private Map<String, String> baseUrls = new LinkedHashMap<>(Map.of("ar_app", "http://app:5000"));

    @NotBlank
    private String healthPath = "/api/health";

    public Map<String, String> getBaseUrls() {
        return baseUrls;
    }

    public void setBaseUrls(Map<String, String> baseUrls) {
        this.baseUrls = baseUrls;
    }

    public String getHealthPath() {
        return healthPath;
    }

    public void setHealthPath(String healthPath) {
        this.healthPath = healthPath;
    }
}
