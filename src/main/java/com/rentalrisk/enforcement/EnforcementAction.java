package com.rentalrisk.enforcement;

import java.time.Instant;

/**
 * A concrete step the engine asks an execution collaborator to take.
 * Created {@code pending}; moves once to executed, failed or cancelled.
 *
 * @param requiredAction what the renter or owner must do to clear it, null for
 *                       notifications and escalations
 */
public record EnforcementAction(
    String id,
    ActionType type,
    Severity severity,
    String message,
    String requiredAction,
    Instant deadline,
    ActionStatus status,
    Instant createdAt,
    Instant executedAt,
    String executionNotes
) {

    public boolean isPending() {
        return status == ActionStatus.PENDING;
    }

    public EnforcementAction executed(Instant at, String notes) {
        return settle(ActionStatus.EXECUTED, at, notes);
    }

    public EnforcementAction failed(Instant at, String notes) {
        return settle(ActionStatus.FAILED, at, notes);
    }

    public EnforcementAction cancelled(Instant at, String notes) {
        return settle(ActionStatus.CANCELLED, at, notes);
    }

    private EnforcementAction settle(ActionStatus next, Instant at, String notes) {
        if (!isPending()) {
            throw new IllegalStateException("action " + id + " is already " + status.getValue());
        }
        return new EnforcementAction(id, type, severity, message, requiredAction, deadline, next, createdAt, at, notes);
    }
}
