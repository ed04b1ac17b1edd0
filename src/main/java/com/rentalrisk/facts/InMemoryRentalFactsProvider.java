package com.rentalrisk.facts;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryRentalFactsProvider implements RentalFactsProvider {

    private final ConcurrentHashMap<String, ProductFacts> products = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RenterFacts> renters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, BookingFacts> bookings = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CategoryNorms> norms = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<SeasonalRiskWindow>> calendars = new ConcurrentHashMap<>();

    public void putProduct(ProductFacts product) {
        products.put(product.productId(), product);
    }

    public void putRenter(RenterFacts renter) {
        renters.put(renter.renterId(), renter);
    }

    public void putBooking(BookingFacts booking) {
        bookings.put(booking.bookingId(), booking);
    }

    public void putCategoryNorms(CategoryNorms categoryNorms) {
        norms.put(categoryNorms.categoryId(), categoryNorms);
    }

    public void putSeasonalCalendar(String categoryId, List<SeasonalRiskWindow> windows) {
        calendars.put(categoryId, List.copyOf(windows));
    }

    @Override
    public Optional<ProductFacts> findProduct(String productId) {
        return Optional.ofNullable(products.get(productId));
    }

    @Override
    public Optional<RenterFacts> findRenter(String renterId) {
        return Optional.ofNullable(renters.get(renterId));
    }

    @Override
    public Optional<BookingFacts> findBooking(String bookingId) {
        return Optional.ofNullable(bookings.get(bookingId));
    }

    @Override
    public Optional<CategoryNorms> findCategoryNorms(String categoryId) {
        return Optional.ofNullable(norms.get(categoryId));
    }

    @Override
    public List<SeasonalRiskWindow> seasonalCalendar(String categoryId) {
        return calendars.getOrDefault(categoryId, List.of());
    }
}
