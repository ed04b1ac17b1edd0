package com.rentalrisk.facts;

import java.math.BigDecimal;

public record ProductFacts(
    String productId,
    String categoryId,
    String ownerId,
    BigDecimal pricePerDay
) {}
