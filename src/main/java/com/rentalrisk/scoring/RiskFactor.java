package com.rentalrisk.scoring;

public enum RiskFactor {
    PRODUCT,
    RENTER,
    BOOKING,
    SEASONAL
}
