package com.phillippitts.autoremediation.service.orchestration;

import com.phillippitts.autoremediation.domain.Finding;
import com.phillippitts.autoremediation.service.remediation.AttemptOutcome;

import java.util.List;
import java.util.Map;

/**
 * What one service's tick did.
 *
 * @param service service processed
 * @param tick tick number
 * @param findings findings recorded this tick
 * @param attempts outcome per incident id that was considered for an automatic attempt
 * @param skipped true when no snapshot could be taken and the service was left alone this tick
 */
public record TickReport(String service,
                         long tick,
                         List<Finding> findings,
                         Map<Long, AttemptOutcome> attempts,
                         boolean skipped) {

    public TickReport {
        findings = List.copyOf(findings);
        attempts = Map.copyOf(attempts);
    }

    static TickReport skipped(String service, long tick) {
        return new TickReport(service, tick, List.of(), Map.of(), true);
    }
}
