package com.rentalrisk.profile;

import java.util.List;

/**
 * Input for creating a risk profile. Nullable fields fall back to defaults:
 * no requirements, enforcement derived from the risk level, no
 * auto-enforcement and no grace period.
 */
public record RiskProfileDraft(
    String productId,
    String categoryId,
    RiskLevel riskLevel,
    MandatoryRequirements mandatoryRequirements,
    List<String> riskFactors,
    List<String> mitigationStrategies,
    EnforcementLevel enforcementLevel,
    Boolean autoEnforcement,
    Integer gracePeriodHours
) {}
