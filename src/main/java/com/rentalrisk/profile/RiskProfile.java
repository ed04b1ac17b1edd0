package com.rentalrisk.profile;

import java.time.Instant;
import java.util.List;

/**
 * Per-product risk policy. One profile per product.
 *
 * @param exempt administrative override: every booking of the product is
 *               treated as exempt from compliance enforcement
 */
public record RiskProfile(
    String id,
    String productId,
    String categoryId,
    RiskLevel riskLevel,
    MandatoryRequirements mandatoryRequirements,
    List<String> riskFactors,
    List<String> mitigationStrategies,
    EnforcementLevel enforcementLevel,
    boolean autoEnforcement,
    int gracePeriodHours,
    boolean exempt,
    Instant createdAt,
    Instant updatedAt
) {

    public RiskProfile {
        riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
        mitigationStrategies = mitigationStrategies == null ? List.of() : List.copyOf(mitigationStrategies);
    }
}
