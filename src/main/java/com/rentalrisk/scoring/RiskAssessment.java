package com.rentalrisk.scoring;

import com.rentalrisk.compliance.ComplianceStatus;
import com.rentalrisk.profile.MandatoryRequirements;
import com.rentalrisk.profile.RiskLevel;

import java.time.Instant;
import java.util.List;

/**
 * Time-bounded risk evaluation of one rental attempt. The compliance status
 * here is provisional: {@code pending}, or {@code exempt} for exempt products.
 */
public record RiskAssessment(
    String id,
    String productId,
    String renterId,
    String bookingId,
    int overallRiskScore,
    RiskLevel riskLevel,
    RiskFactorScores riskFactors,
    List<String> recommendations,
    MandatoryRequirements mandatoryRequirements,
    ComplianceStatus complianceStatus,
    Instant assessmentDate,
    Instant expiresAt
) {

    public RiskAssessment {
        recommendations = List.copyOf(recommendations);
    }
}
