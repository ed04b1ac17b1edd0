package com.rentalrisk.facts;

import com.rentalrisk.error.DependencyException;
import com.rentalrisk.error.NotFoundException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Gathers facts for a decision. Missing subjects become {@link NotFoundException};
 * any failure inside the provider becomes {@link DependencyException}.
 */
@Service
public class RuleFactsService {

    private static final String DEPENDENCY = "rental-facts-provider";

    private final RentalFactsProvider provider;

    public RuleFactsService(RentalFactsProvider provider) {
        this.provider = provider;
    }

    public ProductFacts requireProduct(String productId) {
        return call(() -> provider.findProduct(productId))
            .orElseThrow(() -> new NotFoundException("product", productId));
    }

    public RenterFacts requireRenter(String renterId) {
        return call(() -> provider.findRenter(renterId))
            .orElseThrow(() -> new NotFoundException("renter", renterId));
    }

    public BookingFacts requireBooking(String bookingId) {
        return call(() -> provider.findBooking(bookingId))
            .orElseThrow(() -> new NotFoundException("booking", bookingId));
    }

    public Optional<CategoryNorms> categoryNorms(String categoryId) {
        return call(() -> provider.findCategoryNorms(categoryId));
    }

    public List<SeasonalRiskWindow> seasonalCalendar(String categoryId) {
        List<SeasonalRiskWindow> windows = call(() -> provider.seasonalCalendar(categoryId));
        return windows == null ? List.of() : windows;
    }

    private <T> T call(Supplier<T> lookup) {
        try {
            return lookup.get();
        } catch (RuntimeException ex) {
            throw new DependencyException(DEPENDENCY, ex);
        }
    }
}
