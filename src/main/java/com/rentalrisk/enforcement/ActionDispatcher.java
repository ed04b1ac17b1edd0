package com.rentalrisk.enforcement;

import com.rentalrisk.compliance.ComplianceCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Hands a pending action to its execution collaborator. A collaborator
 * failure marks the action failed; it is not retried here.
 */
@Component
public class ActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

    private final NotificationDispatcher notifications;
    private final BookingBlocker bookingBlocker;
    private final RequirementEnforcer requirementEnforcer;
    private final Clock clock;

    public ActionDispatcher(NotificationDispatcher notifications,
                            BookingBlocker bookingBlocker,
                            RequirementEnforcer requirementEnforcer,
                            Clock clock) {
        this.notifications = notifications;
        this.bookingBlocker = bookingBlocker;
        this.requirementEnforcer = requirementEnforcer;
        this.clock = clock;
    }

    public EnforcementAction dispatch(ComplianceCheck check, EnforcementAction action, String actor) {
        try {
            String notes = execute(check, action);
            if (actor != null) {
                notes = notes + " (approved by " + actor + ")";
            }
            log.info("Executed {} for booking={} action={}", action.type().getValue(), check.bookingId(), action.id());
            return action.executed(clock.instant(), notes);
        } catch (RuntimeException ex) {
            log.warn("Enforcement action {} ({}) for booking={} failed: {}",
                action.id(), action.type().getValue(), check.bookingId(), ex.getMessage());
            return action.failed(clock.instant(), "dispatch failed: " + ex.getMessage());
        }
    }

    private String execute(ComplianceCheck check, EnforcementAction action) {
        return switch (action.type()) {
            case SEND_NOTIFICATION -> {
                notifications.notifyParties(check.bookingId(), check.productId(), check.renterId(), action);
                yield "notification dispatched";
            }
            case REQUIRE_INSURANCE -> {
                requirementEnforcer.requireInsurance(check.bookingId(), action);
                yield "insurance requirement placed";
            }
            case REQUIRE_INSPECTION -> {
                requirementEnforcer.requireInspection(check.bookingId(), action);
                yield "inspection requirement placed";
            }
            case BLOCK_BOOKING -> {
                bookingBlocker.block(check.bookingId(), action.message());
                yield "booking blocked";
            }
            case ESCALATE -> {
                notifications.notifyAdministrators(check.bookingId(), action);
                yield "escalated to administrators";
            }
        };
    }
}
