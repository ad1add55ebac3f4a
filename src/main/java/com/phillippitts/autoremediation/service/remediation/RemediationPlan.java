package com.phillippitts.autoremediation.service.remediation;

import com.phillippitts.autoremediation.domain.ActionType;

import java.util.Objects;

/**
 * Concrete action chosen for an incident.
 *
 * @param actionType what to do
 * @param target lifecycle target (container name)
 * @param reason why this action was chosen, for logs
 */
public record RemediationPlan(ActionType actionType, String target, String reason) {

    public RemediationPlan {
        Objects.requireNonNull(actionType, "actionType");
        Objects.requireNonNull(target, "target");
    }
}
