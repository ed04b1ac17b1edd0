package com.rentalrisk.profile;

import java.util.function.Predicate;

public record RiskProfileFilter(
    String categoryId,
    RiskLevel riskLevel,
    EnforcementLevel enforcementLevel,
    Boolean autoEnforcement
) implements Predicate<RiskProfile> {

    public static RiskProfileFilter any() {
        return new RiskProfileFilter(null, null, null, null);
    }

    @Override
    public boolean test(RiskProfile profile) {
        return (categoryId == null || categoryId.equals(profile.categoryId()))
            && (riskLevel == null || riskLevel == profile.riskLevel())
            && (enforcementLevel == null || enforcementLevel == profile.enforcementLevel())
            && (autoEnforcement == null || autoEnforcement == profile.autoEnforcement());
    }
}
