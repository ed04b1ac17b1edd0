package com.rentalrisk.scoring;

import com.rentalrisk.facts.BookingFacts;
import com.rentalrisk.facts.CategoryNorms;
import com.rentalrisk.facts.ProductFacts;
import com.rentalrisk.facts.RenterFacts;
import com.rentalrisk.facts.SeasonalRiskWindow;
import com.rentalrisk.profile.RiskProfile;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Fact snapshot a single risk assessment is computed from.
 * {@code profile}, {@code booking} and {@code norms} are nullable.
 */
public record ScoringContext(
    ProductFacts product,
    RiskProfile profile,
    RenterFacts renter,
    BookingFacts booking,
    CategoryNorms norms,
    List<SeasonalRiskWindow> seasonalCalendar,
    Instant now,
    LocalDate today
) {

    public ScoringContext {
        seasonalCalendar = seasonalCalendar == null ? List.of() : List.copyOf(seasonalCalendar);
    }
}
