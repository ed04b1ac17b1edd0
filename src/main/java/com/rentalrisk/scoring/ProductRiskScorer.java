package com.rentalrisk.scoring;

import com.rentalrisk.profile.RiskLevel;
import com.rentalrisk.profile.RiskProfile;

/**
 * Starts at the midpoint of the profile's risk band and adds a fixed
 * increment per declared risk factor, never leaving the band. Products
 * without a profile score at the medium midpoint.
 */
public class ProductRiskScorer implements RiskFactorScorer {

    private final int factorIncrement;

    public ProductRiskScorer(int factorIncrement) {
        this.factorIncrement = factorIncrement;
    }

    @Override
    public RiskFactor factor() {
        return RiskFactor.PRODUCT;
    }

    @Override
    public int score(ScoringContext context) {
        RiskProfile profile = context.profile();
        if (profile == null) {
            return RiskLevel.MEDIUM.bandMidpoint();
        }
        RiskLevel level = profile.riskLevel();
        long raw = level.bandMidpoint() + (long) profile.riskFactors().size() * factorIncrement;
        return (int) Math.min(raw, level.bandCeiling());
    }
}
