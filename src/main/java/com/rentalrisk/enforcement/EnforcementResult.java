package com.rentalrisk.enforcement;

import com.rentalrisk.compliance.ComplianceCheck;

import java.util.List;

/**
 * @param actions            actions created by this call, in their final state
 * @param violationsRecorded ledger entries newly created by this call
 */
public record EnforcementResult(
    ComplianceCheck compliance,
    List<EnforcementAction> actions,
    int violationsRecorded
) {

    public EnforcementResult {
        actions = List.copyOf(actions);
    }
}
