package com.phillippitts.autoremediation.presentation.controller;

import com.phillippitts.autoremediation.config.settings.ConfigSource;
import com.phillippitts.autoremediation.domain.AdvisorySignal;
import com.phillippitts.autoremediation.domain.Severity;
import com.phillippitts.autoremediation.service.advisory.AdvisoryInbox;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

/**
 * Intake for external advisors (anomaly detection, failure prediction, forecasting). Signals are
 * queued and become {@code external_advisory} findings on the service's next tick.
 */
@RestController
@RequestMapping("/api/advisories")
class AdvisoryController {

    private static final Logger LOG = LogManager.getLogger(AdvisoryController.class);

    private final AdvisoryInbox inbox;
    private final ConfigSource configSource;
    private final Clock clock;

    AdvisoryController(AdvisoryInbox inbox, ConfigSource configSource, Clock clock) {
        this.inbox = inbox;
        this.configSource = configSource;
        this.clock = clock;
    }

    @PostMapping("/{service}")
    ResponseEntity<Map<String, Object>> submit(@PathVariable String service,
                                               @Valid @RequestBody AdvisoryRequest request) {
        if (!configSource.current().services().contains(service)) {
            throw new IllegalArgumentException("Service is not monitored: " + service);
        }
        inbox.submit(service, new AdvisorySignal(request.source(), request.severity(), request.message(),
                request.evidence(), clock.instant()));
        LOG.info("Advisory from {} accepted for {}", request.source(), service);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "service", service,
                "pending", inbox.pending(service)
        ));
    }

    /**
     * Request body.
     */
    record AdvisoryRequest(
            @NotBlank String source,
            Severity severity,
            String message,
            Map<String, Object> evidence
    ) {}
}
