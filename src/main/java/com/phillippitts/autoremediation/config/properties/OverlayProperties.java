package com.phillippitts.autoremediation.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Optional JSON overlay file re-read between ticks.
 */
@ConfigurationProperties(prefix = "remediation.config")
public class OverlayProperties {

    /** Path of the overlay file; blank disables the overlay. */
    private String overlayFile = "";

    public String getOverlayFile() {
        return overlayFile;
    }

    public void setOverlayFile(String overlayFile) {
        this.overlayFile = overlayFile;
    }
}
