package com.rentalrisk.enforcement;

import com.rentalrisk.compliance.ComplianceCheck;
import com.rentalrisk.compliance.ComplianceRequest;
import com.rentalrisk.compliance.ComplianceStateTracker;
import com.rentalrisk.error.ConflictException;
import com.rentalrisk.error.NotFoundException;
import com.rentalrisk.facts.BookingFacts;
import com.rentalrisk.facts.RuleFactsService;
import com.rentalrisk.profile.RiskProfile;
import com.rentalrisk.profile.RiskProfileService;
import com.rentalrisk.violation.PolicyViolation;
import com.rentalrisk.violation.ViolationDraft;
import com.rentalrisk.violation.ViolationLedger;
import com.rentalrisk.violation.ViolationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs enforcement for a booking: re-checks compliance, records the decided
 * actions against the check, dispatches them when the product enforces
 * automatically, and records violations for executed blocking actions.
 *
 * Repeated calls are idempotent: an action type already pending or executed
 * in the current status episode is not added again, and the ledger holds
 * at most one open violation per booking and type.
 */
@Service
public class EnforcementService {

    private static final Logger log = LoggerFactory.getLogger(EnforcementService.class);

    private static final Set<ActionType> VIOLATION_TRIGGERS =
        EnumSet.of(ActionType.BLOCK_BOOKING, ActionType.REQUIRE_INSURANCE, ActionType.REQUIRE_INSPECTION);

    private final ComplianceStateTracker tracker;
    private final RiskProfileService profiles;
    private final RuleFactsService facts;
    private final EnforcementDecisionEngine decisions;
    private final ActionDispatcher dispatcher;
    private final ViolationLedger ledger;
    private final Clock clock;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public EnforcementService(ComplianceStateTracker tracker,
                              RiskProfileService profiles,
                              RuleFactsService facts,
                              EnforcementDecisionEngine decisions,
                              ActionDispatcher dispatcher,
                              ViolationLedger ledger,
                              Clock clock) {
        this.tracker = tracker;
        this.profiles = profiles;
        this.facts = facts;
        this.decisions = decisions;
        this.dispatcher = dispatcher;
        this.ledger = ledger;
        this.clock = clock;
    }

    public EnforcementResult triggerEnforcement(String bookingId) {
        BookingFacts booking = facts.requireBooking(bookingId);
        ComplianceCheck check = tracker.checkCompliance(
            new ComplianceRequest(bookingId, booking.productId(), booking.renterId(), true));
        if (booking.status().isTerminal()) {
            return new EnforcementResult(check, List.of(), 0);
        }
        RiskProfile profile = profiles.requireByProduct(booking.productId());

        Instant now = clock.instant();
        EnforcementPlan plan = decisions.decide(check, profile, now);

        AtomicReference<List<EnforcementAction>> added = new AtomicReference<>(List.of());
        check = tracker.update(bookingId, current -> {
            List<EnforcementAction> fresh = withoutRepeats(current, plan.actions());
            added.set(fresh);
            return current.withAppendedActions(fresh);
        });

        List<EnforcementAction> settled = new ArrayList<>();
        if (profile.autoEnforcement()) {
            for (EnforcementAction action : added.get()) {
                if (!claim(bookingId, action.id())) {
                    log.info("Action {} on booking={} left pending dispatch: no longer claimable",
                        action.id(), bookingId);
                    continue;
                }
                try {
                    EnforcementAction result = dispatcher.dispatch(check, action, null);
                    check = settle(bookingId, result);
                } finally {
                    inFlight.remove(action.id());
                }
            }
        }
        for (EnforcementAction action : added.get()) {
            settled.add(check.findAction(action.id()).orElse(action));
        }

        int recorded = recordViolations(check, plan, settled);
        log.info("Enforcement booking={} status={} level={} actions={} violationsRecorded={}",
            bookingId, check.status().getValue(), profile.enforcementLevel().getValue(), settled.size(), recorded);
        return new EnforcementResult(check, settled, recorded);
    }

    /**
     * Dispatches a pending action held for manual approval.
     */
    public EnforcementResult approveAction(String bookingId, String actionId, String approverId) {
        AtomicReference<EnforcementAction> claimed = new AtomicReference<>();
        ComplianceCheck check = tracker.update(bookingId, current -> {
            EnforcementAction pending = requirePending(current, actionId);
            if (!inFlight.add(actionId)) {
                throw new ConflictException("enforcement action " + actionId + " is already being dispatched");
            }
            claimed.set(pending);
            return current;
        });
        EnforcementAction action = claimed.get();

        try {
            RiskProfile profile = profiles.requireByProduct(check.productId());
            EnforcementAction result = dispatcher.dispatch(check, action, approverId);
            ComplianceCheck updated = settle(bookingId, result);
            EnforcementPlan plan = decisions.decide(updated, profile, clock.instant());
            int recorded = recordViolations(updated, plan, List.of(result));
            log.info("Action {} ({}) on booking={} approved by {}: {}",
                actionId, action.type().getValue(), bookingId, approverId, result.status().getValue());
            return new EnforcementResult(updated, List.of(result), recorded);
        } finally {
            inFlight.remove(actionId);
        }
    }

    public ComplianceCheck cancelAction(String bookingId, String actionId, String reason) {
        Instant now = clock.instant();
        ComplianceCheck updated = tracker.update(bookingId, current -> {
            EnforcementAction action = requirePending(current, actionId);
            if (inFlight.contains(actionId)) {
                throw new ConflictException("enforcement action " + actionId + " is being dispatched");
            }
            return current.withReplacedAction(action.cancelled(now, reason));
        });
        log.info("Action {} on booking={} cancelled: {}", actionId, bookingId, reason);
        return updated;
    }

    /**
     * Marks a still-pending action as in flight. The check is read and the
     * claim taken inside one tracker update, so a cancel or a second
     * dispatch of the same action cannot interleave.
     */
    private boolean claim(String bookingId, String actionId) {
        AtomicBoolean claimed = new AtomicBoolean();
        tracker.update(bookingId, current -> {
            boolean pending = current.findAction(actionId).map(EnforcementAction::isPending).orElse(false);
            claimed.set(pending && inFlight.add(actionId));
            return current;
        });
        return claimed.get();
    }

    /**
     * Stores a dispatch outcome unless the action left the pending state
     * in the meantime.
     */
    private ComplianceCheck settle(String bookingId, EnforcementAction result) {
        return tracker.update(bookingId, current -> {
            boolean pending = current.findAction(result.id()).map(EnforcementAction::isPending).orElse(false);
            if (!pending) {
                log.warn("Dispatch outcome for action {} on booking={} dropped: action no longer pending",
                    result.id(), bookingId);
                return current;
            }
            return current.withReplacedAction(result);
        });
    }

    private int recordViolations(ComplianceCheck check, EnforcementPlan plan, List<EnforcementAction> settled) {
        boolean triggered = settled.stream()
            .anyMatch(a -> a.status() == ActionStatus.EXECUTED && VIOLATION_TRIGGERS.contains(a.type()));
        if (!triggered || plan.violationTypes().isEmpty()) {
            return 0;
        }
        int recorded = 0;
        for (ViolationType type : plan.violationTypes()) {
            ViolationDraft draft = new ViolationDraft(check.bookingId(), check.productId(), check.renterId(),
                type, plan.violationSeverity(), describe(type, check), null);
            try {
                PolicyViolation violation = ledger.record(draft);
                if (plan.escalateViolations()) {
                    ledger.escalate(violation.id());
                }
                recorded++;
            } catch (ConflictException ex) {
                log.warn("Open {} violation already recorded for booking={}", type.getValue(), check.bookingId());
            }
        }
        return recorded;
    }

    /**
     * Drops planned actions already pending or executed in the current status
     * episode. Notifications repeat only at a new severity.
     */
    private static List<EnforcementAction> withoutRepeats(ComplianceCheck current, List<EnforcementAction> planned) {
        Set<RepeatKey> taken = new HashSet<>();
        for (EnforcementAction existing : current.currentEpisodeActions()) {
            if (existing.status() == ActionStatus.PENDING || existing.status() == ActionStatus.EXECUTED) {
                taken.add(RepeatKey.of(existing));
            }
        }
        return planned.stream()
            .filter(a -> !taken.contains(RepeatKey.of(a)))
            .toList();
    }

    private record RepeatKey(ActionType type, Severity severity) {

        static RepeatKey of(EnforcementAction action) {
            return new RepeatKey(action.type(),
                action.type() == ActionType.SEND_NOTIFICATION ? action.severity() : null);
        }
    }

    private static EnforcementAction requirePending(ComplianceCheck check, String actionId) {
        EnforcementAction action = check.findAction(actionId)
            .orElseThrow(() -> new NotFoundException("enforcement action", actionId));
        if (!action.isPending()) {
            throw new ConflictException("enforcement action " + actionId + " is already " + action.status().getValue());
        }
        return action;
    }

    private static String describe(ViolationType type, ComplianceCheck check) {
        if (type == ViolationType.EXPIRED_COMPLIANCE) {
            return "Grace period ended " + check.gracePeriodEndsAt() + " with requirements still missing: "
                + check.missingRequirements();
        }
        return "Booking " + check.bookingId() + " enforced for " + type.getValue();
    }
}
