package com.rentalrisk.facts;

import java.math.BigDecimal;

/**
 * Typical booking shape for a category, used to judge whether a booking is
 * unusually long or valuable.
 */
public record CategoryNorms(
    String categoryId,
    int typicalDurationDays,
    BigDecimal typicalBookingValue
) {}
