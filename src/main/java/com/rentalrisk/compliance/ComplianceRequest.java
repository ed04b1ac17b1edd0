package com.rentalrisk.compliance;

/**
 * @param forceCheck re-evaluate even if the stored check is still fresh
 */
public record ComplianceRequest(
    String bookingId,
    String productId,
    String renterId,
    boolean forceCheck
) {}
