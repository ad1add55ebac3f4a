package com.phillippitts.autoremediation.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Command templates for the container lifecycle provider. {@code {target}} and
 * {@code {replicas}} are substituted per call; templates are split on whitespace, never run
 * through a shell.
 */
@Validated
@ConfigurationProperties(prefix = "remediation.lifecycle")
public class LifecycleProperties {

    @NotBlank
    private String restartCommand = "docker restart {target}";

    @NotBlank
    private String scaleCommand = "docker compose up -d --no-recreate --scale {target}={replicas}";

    /** Must print {@code true} on stdout when the target is running. */
    @NotBlank
    private String healthCommand = "docker inspect -f {{.State.Running}} {target}";

    @Min(0)
    private int initialReplicas = 1;

    public String getRestartCommand() {
        return restartCommand;
    }

    public void setRestartCommand(String restartCommand) {
        this.restartCommand = restartCommand;
    }

    public String getScaleCommand() {
        return scaleCommand;
    }

    public void setScaleCommand(String scaleCommand) {
        this.scaleCommand = scaleCommand;
    }

    public String getHealthCommand() {
        return healthCommand;
    }

    public void setHealthCommand(String healthCommand) {
        this.healthCommand = healthCommand;
    }

    public int getInitialReplicas() {
        return initialReplicas;
    }

    public void setInitialReplicas(int initialReplicas) {
        this.initialReplicas = initialReplicas;
    }
}
