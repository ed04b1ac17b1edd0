package com.rentalrisk.enforcement;

/**
 * Puts a hold on a booking until a missing insurance policy or inspection
 * is supplied.
 */
public interface RequirementEnforcer {

    void requireInsurance(String bookingId, EnforcementAction action);

    void requireInspection(String bookingId, EnforcementAction action);
}
