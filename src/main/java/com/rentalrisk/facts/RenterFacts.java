package com.rentalrisk.facts;

import com.rentalrisk.regulation.BackgroundCheckStatus;

import java.time.Instant;
import java.time.LocalDate;
import java.time.Period;
import java.util.List;

/**
 * Renter history and identity signals. History fields are nullable: a renter
 * the marketplace knows nothing about has all three unset.
 */
public record RenterFacts(
    String renterId,
    boolean verified,
    boolean kycVerified,
    Instant accountCreatedAt,
    Integer completedBookings,
    Integer priorViolations,
    LocalDate dateOfBirth,
    boolean hasLicense,
    String licenseType,
    BackgroundCheckStatus backgroundCheckStatus,
    List<String> documentsProvided
) {

    public RenterFacts {
        documentsProvided = documentsProvided == null ? List.of() : List.copyOf(documentsProvided);
    }

    public Integer ageOn(LocalDate date) {
        if (dateOfBirth == null) {
            return null;
        }
        return Period.between(dateOfBirth, date).getYears();
    }
}
