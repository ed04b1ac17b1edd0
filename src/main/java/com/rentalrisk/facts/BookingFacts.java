package com.rentalrisk.facts;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Set;

/**
 * Booking parameters plus the evidence the compliance check looks at:
 * the attached insurance policy and the inspection types already completed.
 *
 * @param countryId country whose category regulation applies; null when the
 *                  booking is not bound to a regulated jurisdiction
 * @param season    season label matched against regulation seasonal
 *                  restrictions, e.g. "winter"
 */
public record BookingFacts(
    String bookingId,
    String productId,
    String renterId,
    LocalDate startDate,
    LocalDate endDate,
    BigDecimal totalValue,
    String countryId,
    String season,
    BookingStatus status,
    InsuranceCoverage insurance,
    Set<String> completedInspectionTypes
) {

    public BookingFacts {
        completedInspectionTypes = completedInspectionTypes == null ? Set.of() : Set.copyOf(completedInspectionTypes);
    }

    /** Inclusive day count; null when either date is missing. */
    public Integer durationDays() {
        if (startDate == null || endDate == null) {
            return null;
        }
        return (int) ChronoUnit.DAYS.between(startDate, endDate) + 1;
    }

    public boolean hasActiveInsurance() {
        return insurance != null && insurance.active();
    }
}
