package com.rentalrisk.enforcement;

public interface BookingBlocker {

    void block(String bookingId, String reason);
}
