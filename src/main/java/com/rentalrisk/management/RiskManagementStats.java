package com.rentalrisk.management;

/**
 * @param complianceRate    percentage of checked bookings currently compliant
 * @param violationRate     percentage of checked bookings with an open violation
 * @param averageRiskScore  rounded mean of all recorded assessments
 */
public record RiskManagementStats(
    long totalRiskProfiles,
    double complianceRate,
    double violationRate,
    long averageRiskScore,
    EnforcementActionStats enforcementActions,
    RiskDistribution riskDistribution
) {

    public record EnforcementActionStats(long total, long successful, long failed, long pending) {}

    public record RiskDistribution(long low, long medium, long high, long critical) {}
}
