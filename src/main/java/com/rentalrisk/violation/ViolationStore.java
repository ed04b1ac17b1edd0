package com.rentalrisk.violation;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Append-only violation storage. At most one open violation exists per
 * (booking, type); the check and the insert are a single atomic step.
 */
public interface ViolationStore {

    /**
     * Inserts {@code violation} unless an open violation of the same type is
     * already recorded for its booking.
     *
     * @return false when the slot was taken
     */
    boolean insertIfNoOpen(PolicyViolation violation);

    Optional<PolicyViolation> findById(String id);

    Optional<PolicyViolation> update(String id, UnaryOperator<PolicyViolation> remapping);

    List<PolicyViolation> findAll();
}
