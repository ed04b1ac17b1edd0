package com.rentalrisk.scoring;

import com.rentalrisk.compliance.ComplianceStatus;
import com.rentalrisk.profile.RiskLevel;

import java.util.function.Predicate;

/**
 * Null fields match anything.
 */
public record AssessmentFilter(
    String productId,
    String renterId,
    String bookingId,
    RiskLevel riskLevel,
    ComplianceStatus complianceStatus
) implements Predicate<RiskAssessment> {

    public static AssessmentFilter any() {
        return new AssessmentFilter(null, null, null, null, null);
    }

    public static AssessmentFilter forProduct(String productId) {
        return new AssessmentFilter(productId, null, null, null, null);
    }

    @Override
    public boolean test(RiskAssessment assessment) {
        return (productId == null || productId.equals(assessment.productId()))
            && (renterId == null || renterId.equals(assessment.renterId()))
            && (bookingId == null || bookingId.equals(assessment.bookingId()))
            && (riskLevel == null || riskLevel == assessment.riskLevel())
            && (complianceStatus == null || complianceStatus == assessment.complianceStatus());
    }
}
