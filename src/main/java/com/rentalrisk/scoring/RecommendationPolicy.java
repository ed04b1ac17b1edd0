package com.rentalrisk.scoring;

import com.rentalrisk.config.RiskEngineProperties.RecommendationThresholds;
import com.rentalrisk.profile.MandatoryRequirements;
import com.rentalrisk.profile.RiskLevel;

import java.util.ArrayList;
import java.util.List;

/**
 * Threshold rules turning a score into advice. Recommendations may ask for
 * more than the profile requires, never less.
 */
public class RecommendationPolicy {

    private final RecommendationThresholds thresholds;

    public RecommendationPolicy(RecommendationThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public List<String> recommend(RiskScore score, MandatoryRequirements requirements, boolean hasProfile) {
        List<String> recommendations = new ArrayList<>();
        RiskLevel level = score.level();

        if (!hasProfile) {
            recommendations.add("No risk profile on file for this product; create one to enforce requirements");
        }
        if (level == RiskLevel.HIGH || level == RiskLevel.CRITICAL) {
            if (!requirements.insuranceRequired()) {
                recommendations.add("Mandatory insurance coverage required");
            }
            recommendations.add("Pre-rental inspection mandatory");
            recommendations.add("Consider additional security deposit");
        }
        if (score.overall() >= thresholds.mandatoryInspectionScore() && !requirements.inspectionRequired()) {
            recommendations.add("Require a mandatory inspection even though the risk profile does not");
        }
        if (score.factors().renterRisk() > thresholds.renterVerificationScore()) {
            recommendations.add("Enhanced user verification recommended");
            recommendations.add("Consider requiring references");
        }
        if (score.factors().bookingRisk() > thresholds.disputeMonitoringScore()) {
            recommendations.add("Monitor for potential disputes");
            recommendations.add("Consider mediation services");
        }
        return recommendations;
    }
}
