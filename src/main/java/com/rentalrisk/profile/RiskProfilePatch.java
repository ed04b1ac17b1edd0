package com.rentalrisk.profile;

import java.util.List;

/**
 * Partial update of a risk profile; null fields are left unchanged.
 */
public record RiskProfilePatch(
    RiskLevel riskLevel,
    MandatoryRequirements mandatoryRequirements,
    List<String> riskFactors,
    List<String> mitigationStrategies,
    EnforcementLevel enforcementLevel,
    Boolean autoEnforcement,
    Integer gracePeriodHours,
    Boolean exempt
) {

    public static RiskProfilePatch exemption(boolean exempt) {
        return new RiskProfilePatch(null, null, null, null, null, null, null, exempt);
    }
}
