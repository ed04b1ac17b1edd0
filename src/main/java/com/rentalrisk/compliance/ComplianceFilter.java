package com.rentalrisk.compliance;

import java.util.function.Predicate;

/**
 * Null fields match anything.
 */
public record ComplianceFilter(
    ComplianceStatus status,
    String productId,
    String renterId
) implements Predicate<ComplianceCheck> {

    public static ComplianceFilter any() {
        return new ComplianceFilter(null, null, null);
    }

    @Override
    public boolean test(ComplianceCheck check) {
        return (status == null || status == check.status())
            && (productId == null || productId.equals(check.productId()))
            && (renterId == null || renterId.equals(check.renterId()));
    }
}
