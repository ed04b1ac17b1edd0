package com.rentalrisk.violation;

import com.rentalrisk.enforcement.Severity;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Ledger entry. Entries are never deleted; once resolved they are frozen.
 * {@code assignedTo} names the inspector following the case, if any.
 */
public record PolicyViolation(
    String id,
    String bookingId,
    String productId,
    String renterId,
    ViolationType violationType,
    Severity severity,
    String description,
    Instant detectedAt,
    Instant resolvedAt,
    List<String> resolutionActions,
    String resolutionNotes,
    BigDecimal penaltyAmount,
    ViolationStatus status,
    String assignedTo
) {

    public PolicyViolation {
        resolutionActions = resolutionActions == null ? List.of() : List.copyOf(resolutionActions);
    }

    public boolean isOpen() {
        return status.isOpen();
    }

    PolicyViolation resolved(List<String> actions, String notes, Instant at) {
        return new PolicyViolation(id, bookingId, productId, renterId, violationType, severity, description,
            detectedAt, at, actions, notes, penaltyAmount, ViolationStatus.RESOLVED, assignedTo);
    }

    PolicyViolation escalated() {
        return new PolicyViolation(id, bookingId, productId, renterId, violationType, severity, description,
            detectedAt, resolvedAt, resolutionActions, resolutionNotes, penaltyAmount, ViolationStatus.ESCALATED, assignedTo);
    }

    PolicyViolation withPenalty(BigDecimal amount) {
        return new PolicyViolation(id, bookingId, productId, renterId, violationType, severity, description,
            detectedAt, resolvedAt, resolutionActions, resolutionNotes, amount, status, assignedTo);
    }

    PolicyViolation withAssignee(String inspectorId) {
        return new PolicyViolation(id, bookingId, productId, renterId, violationType, severity, description,
            detectedAt, resolvedAt, resolutionActions, resolutionNotes, penaltyAmount, status, inspectorId);
    }
}
