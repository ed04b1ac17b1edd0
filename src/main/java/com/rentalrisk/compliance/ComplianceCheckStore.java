package com.rentalrisk.compliance;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface ComplianceCheckStore {

    Optional<ComplianceCheck> findByBooking(String bookingId);

    /**
     * Atomically replaces the booking's check with {@code remapping.apply(current)};
     * {@code current} is null when the booking has no check yet.
     */
    ComplianceCheck compute(String bookingId, UnaryOperator<ComplianceCheck> remapping);

    /** Atomic update of an existing check; empty when there is none. */
    Optional<ComplianceCheck> update(String bookingId, UnaryOperator<ComplianceCheck> remapping);

    List<ComplianceCheck> findAll();
}
