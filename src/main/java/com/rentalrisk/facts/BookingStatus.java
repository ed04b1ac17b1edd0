package com.rentalrisk.facts;

public enum BookingStatus {
    PENDING,
    CONFIRMED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    /** Compliance of a finished booking is frozen. */
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
