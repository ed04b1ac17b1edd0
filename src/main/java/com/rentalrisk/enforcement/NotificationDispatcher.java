package com.rentalrisk.enforcement;

/**
 * Fire-and-forget delivery of enforcement notices. Delivery and retries are
 * the implementation's concern.
 */
public interface NotificationDispatcher {

    void notifyParties(String bookingId, String productId, String renterId, EnforcementAction action);

    void notifyAdministrators(String bookingId, EnforcementAction action);
}
