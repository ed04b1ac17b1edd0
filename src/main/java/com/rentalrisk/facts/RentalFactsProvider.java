package com.rentalrisk.facts;

import java.util.List;
import java.util.Optional;

/**
 * Read-only source of the marketplace facts the engine decides on.
 * Implementations may call remote services and may fail; callers go through
 * {@link RuleFactsService} which turns such failures into dependency errors.
 */
public interface RentalFactsProvider {

    Optional<ProductFacts> findProduct(String productId);

    Optional<RenterFacts> findRenter(String renterId);

    Optional<BookingFacts> findBooking(String bookingId);

    Optional<CategoryNorms> findCategoryNorms(String categoryId);

    /** Empty when the category has no seasonal calendar. */
    List<SeasonalRiskWindow> seasonalCalendar(String categoryId);
}
