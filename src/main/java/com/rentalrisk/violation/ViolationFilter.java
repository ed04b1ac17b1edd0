package com.rentalrisk.violation;

import com.rentalrisk.enforcement.Severity;

import java.util.function.Predicate;

public record ViolationFilter(
    ViolationStatus status,
    Severity severity,
    String bookingId,
    String productId,
    String renterId,
    ViolationType violationType
) implements Predicate<PolicyViolation> {

    public static ViolationFilter any() {
        return new ViolationFilter(null, null, null, null, null, null);
    }

    public static ViolationFilter forBooking(String bookingId) {
        return new ViolationFilter(null, null, bookingId, null, null, null);
    }

    @Override
    public boolean test(PolicyViolation violation) {
        return (status == null || status == violation.status())
            && (severity == null || severity == violation.severity())
            && (bookingId == null || bookingId.equals(violation.bookingId()))
            && (productId == null || productId.equals(violation.productId()))
            && (renterId == null || renterId.equals(violation.renterId()))
            && (violationType == null || violationType == violation.violationType());
    }
}
