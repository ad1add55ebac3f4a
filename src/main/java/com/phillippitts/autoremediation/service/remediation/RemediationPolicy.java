package com.phillippitts.autoremediation.service.remediation;

import com.phillippitts.autoremediation.domain.ActionType;
import com.phillippitts.autoremediation.domain.FindingKind;
import com.phillippitts.autoremediation.domain.Incident;
import com.phillippitts.autoremediation.domain.RemediationSettings;
import org.springframework.stereotype.Component;

/**
 * Maps an incident to the action to take.
 *
 * <ol>
 *   <li>An override for the incident's kind always wins.</li>
 *   <li>{@code high_error_rate} uses the configured error-rate action.</li>
 *   <li>{@code external_advisory} uses the configured advisory action.</li>
 *   <li>Everything else restarts the container.</li>
 * </ol>
 */
@Component
public class RemediationPolicy {

    /**
     * @throws com.phillippitts.autoremediation.exception.UnknownActionTypeException if the
     *         configured code for this incident does not name an action
     */
    public RemediationPlan planFor(Incident incident, RemediationSettings settings) {
        RemediationSettings.ActionPolicy policy = settings.policy();
        String target = policy.targetFor(incident.service());

        String override = policy.overrides().get(incident.kind().code());
        if (override != null) {
            return new RemediationPlan(ActionType.fromCode(override), target,
                    "override for " + incident.kind().code());
        }
        if (incident.kind() == FindingKind.HIGH_ERROR_RATE) {
            return new RemediationPlan(ActionType.fromCode(policy.errorRateAction()), target,
                    "error-rate policy");
        }
        if (incident.kind() == FindingKind.EXTERNAL_ADVISORY) {
            return new RemediationPlan(ActionType.fromCode(policy.advisoryAction()), target,
                    "advisory policy");
        }
        return new RemediationPlan(ActionType.RESTART_CONTAINER, target, "default for " + incident.kind().code());
    }
}
