package com.phillippitts.autoremediation.service.health;

import com.phillippitts.autoremediation.config.settings.ConfigSource;
import com.phillippitts.autoremediation.domain.BreakerState;
import com.phillippitts.autoremediation.domain.IncidentStatus;
import com.phillippitts.autoremediation.service.breaker.CircuitBreaker;
import com.phillippitts.autoremediation.service.store.RemediationStateStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of the remediation loop, derived from the breakers of the monitored services:
 * <ul>
 *   <li>UP: every breaker CLOSED</li>
 *   <li>DEGRADED: at least one HALF_OPEN, none OPEN</li>
 *   <li>DOWN: at least one OPEN (a service is no longer being remediated)</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health.
 */
@Component
public class RemediationHealthIndicator implements HealthIndicator {

    private final ConfigSource configSource;
    private final CircuitBreaker breaker;
    private final RemediationStateStore store;

    public RemediationHealthIndicator(ConfigSource configSource,
                                      CircuitBreaker breaker,
                                      RemediationStateStore store) {
        this.configSource = configSource;
        this.breaker = breaker;
        this.store = store;
    }

    @Override
    public Health health() {
        Map<String, String> breakers = new LinkedHashMap<>();
        boolean anyOpen = false;
        boolean anyHalfOpen = false;
        for (String service : configSource.current().services()) {
            BreakerState state = breaker.currentState(service).state();
            breakers.put(service, state.name());
            anyOpen |= state == BreakerState.OPEN;
            anyHalfOpen |= state == BreakerState.HALF_OPEN;
        }
        int active = store.findIncidentsByStatus(null, IncidentStatus.ACTIVE).size();
        int escalated = store.findIncidentsByStatus(null, IncidentStatus.ESCALATED).size();

        Health.Builder builder = new Health.Builder();
        if (anyOpen) {
            builder.down().withDetail("status", "Remediation suspended for at least one service");
        } else if (anyHalfOpen) {
            builder.status("DEGRADED").withDetail("status", "Recovery attempt pending");
        } else {
            builder.up().withDetail("status", "All breakers closed");
        }
        return builder
                .withDetail("breakers", breakers)
                .withDetail("activeIncidents", active)
                .withDetail("escalatedIncidents", escalated)
                .build();
    }
}
