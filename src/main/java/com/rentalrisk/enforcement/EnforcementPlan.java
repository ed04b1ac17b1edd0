package com.rentalrisk.enforcement;

import com.rentalrisk.violation.ViolationType;

import java.util.List;

/**
 * What enforcement should do for one compliance check.
 *
 * @param actions           new actions, all {@code pending}
 * @param violationTypes    ledger entries to record once a blocking or
 *                          {@code require_*} action has executed
 * @param violationSeverity severity of those entries, null when none are planned
 * @param escalateViolations whether recorded entries go straight to escalated
 */
public record EnforcementPlan(
    List<EnforcementAction> actions,
    List<ViolationType> violationTypes,
    Severity violationSeverity,
    boolean escalateViolations
) {

    public EnforcementPlan {
        actions = List.copyOf(actions);
        violationTypes = List.copyOf(violationTypes);
    }

    public static EnforcementPlan none() {
        return new EnforcementPlan(List.of(), List.of(), null, false);
    }
}
