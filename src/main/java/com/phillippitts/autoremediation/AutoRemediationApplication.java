package com.phillippitts.autoremediation;

import com.phillippitts.autoremediation.config.properties.LifecycleProperties;
import com.phillippitts.autoremediation.config.properties.MetricsSourceProperties;
import com.phillippitts.autoremediation.config.properties.MonitorProperties;
import com.phillippitts.autoremediation.config.properties.NotificationProperties;
import com.phillippitts.autoremediation.config.properties.OverlayProperties;
import com.phillippitts.autoremediation.config.properties.RemediationProperties;
import com.phillippitts.autoremediation.config.properties.ThresholdProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        MonitorProperties.class,
        ThresholdProperties.class,
        RemediationProperties.class,
        NotificationProperties.class,
        MetricsSourceProperties.class,
        LifecycleProperties.class,
        OverlayProperties.class
})
@EnableScheduling
public class AutoRemediationApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutoRemediationApplication.class, args);
    }

}
