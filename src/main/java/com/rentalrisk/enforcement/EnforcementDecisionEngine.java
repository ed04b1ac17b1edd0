package com.rentalrisk.enforcement;

import com.rentalrisk.compliance.ComplianceCheck;
import com.rentalrisk.compliance.MissingRequirement;
import com.rentalrisk.profile.EnforcementLevel;
import com.rentalrisk.profile.RiskProfile;
import com.rentalrisk.violation.ViolationType;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Maps a compliance check and the product's enforcement level to actions.
 * Pure: the only inputs are the arguments, and nothing is dispatched here.
 *
 * <pre>
 * non_compliant  lenient     notify
 *                moderate    notify, require_*
 *                strict      notify, require_*, block_booking
 *                very_strict notify, require_*, block_booking, escalate
 * grace_period   any         notify (severity rises as the deadline nears)
 * otherwise                  nothing
 * </pre>
 */
@Component
public class EnforcementDecisionEngine {

    public EnforcementPlan decide(ComplianceCheck check, RiskProfile profile, Instant now) {
        switch (check.status()) {
            case GRACE_PERIOD:
                return new EnforcementPlan(List.of(graceReminder(check, profile, now)), List.of(), null, false);
            case NON_COMPLIANT:
                return nonCompliant(check, profile, now);
            default:
                return EnforcementPlan.none();
        }
    }

    private EnforcementAction graceReminder(ComplianceCheck check, RiskProfile profile, Instant now) {
        Instant endsAt = check.gracePeriodEndsAt();
        return action(ActionType.SEND_NOTIFICATION, graceSeverity(endsAt, profile.gracePeriodHours(), now),
            "Booking " + check.bookingId() + " is not compliant (" + describe(check.missingRequirements())
                + "). Resolve before " + endsAt + " to avoid enforcement.",
            "Provide: " + describe(check.missingRequirements()),
            endsAt, now);
    }

    static Severity graceSeverity(Instant endsAt, int gracePeriodHours, Instant now) {
        if (endsAt == null || gracePeriodHours <= 0) {
            return Severity.HIGH;
        }
        double remaining = Math.max(0, Duration.between(now, endsAt).toMillis());
        double fraction = remaining / Duration.ofHours(gracePeriodHours).toMillis();
        if (fraction >= 0.5) {
            return Severity.LOW;
        }
        if (fraction >= 0.25) {
            return Severity.MEDIUM;
        }
        return Severity.HIGH;
    }

    private EnforcementPlan nonCompliant(ComplianceCheck check, RiskProfile profile, Instant now) {
        EnforcementLevel level = profile.enforcementLevel();
        Severity severity = severityFor(level);
        String missing = describe(check.missingRequirements());
        List<EnforcementAction> actions = new ArrayList<>();

        actions.add(action(ActionType.SEND_NOTIFICATION, severity,
            "Booking " + check.bookingId() + " is not compliant: " + missing,
            "Provide: " + missing, null, now));

        if (level.isAtLeast(EnforcementLevel.MODERATE)) {
            Instant deadline = now.plus(Duration.ofHours(profile.mandatoryRequirements().complianceDeadlineHours()));
            Set<ActionType> remedies = new LinkedHashSet<>();
            for (MissingRequirement requirement : check.missingRequirements()) {
                requirement.remedy().ifPresent(remedies::add);
            }
            for (ActionType remedy : remedies) {
                actions.add(action(remedy, severity, remedyMessage(remedy, check),
                    remedyInstruction(remedy, profile), deadline, now));
            }
        }
        if (level.isAtLeast(EnforcementLevel.STRICT)) {
            actions.add(action(ActionType.BLOCK_BOOKING, severity,
                "Booking " + check.bookingId() + " is blocked until requirements are met: " + missing,
                "Resolve: " + missing, null, now));
        }
        if (level.isAtLeast(EnforcementLevel.VERY_STRICT)) {
            actions.add(action(ActionType.ESCALATE, Severity.CRITICAL,
                "Booking " + check.bookingId() + " escalated for administrative review",
                null, null, now));
        }

        if (level == EnforcementLevel.LENIENT) {
            return new EnforcementPlan(actions, List.of(), null, false);
        }
        return new EnforcementPlan(actions, violationTypes(check), severity,
            level == EnforcementLevel.VERY_STRICT);
    }

    /**
     * An episode whose grace period ran out is recorded as expired compliance;
     * otherwise each ledger-tracked gap is recorded on its own.
     */
    private static List<ViolationType> violationTypes(ComplianceCheck check) {
        if (check.gracePeriodEndsAt() != null) {
            return List.of(ViolationType.EXPIRED_COMPLIANCE);
        }
        Set<ViolationType> types = new LinkedHashSet<>();
        for (MissingRequirement requirement : check.missingRequirements()) {
            requirement.violationType().ifPresent(types::add);
        }
        return List.copyOf(types);
    }

    private static Severity severityFor(EnforcementLevel level) {
        return switch (level) {
            case LENIENT -> Severity.LOW;
            case MODERATE -> Severity.MEDIUM;
            case STRICT -> Severity.HIGH;
            case VERY_STRICT -> Severity.CRITICAL;
        };
    }

    private static String remedyMessage(ActionType remedy, ComplianceCheck check) {
        return remedy == ActionType.REQUIRE_INSURANCE
            ? "Booking " + check.bookingId() + " requires valid insurance coverage"
            : "Booking " + check.bookingId() + " requires a completed inspection";
    }

    private static String remedyInstruction(ActionType remedy, RiskProfile profile) {
        if (remedy == ActionType.REQUIRE_INSURANCE) {
            return profile.mandatoryRequirements().hasCoverageFloor()
                ? "Attach an active insurance policy covering at least " + profile.mandatoryRequirements().minCoverage()
                : "Attach an active insurance policy";
        }
        List<String> types = profile.mandatoryRequirements().inspectionTypes();
        return types.isEmpty()
            ? "Complete a pre-rental inspection"
            : "Complete inspections: " + String.join(", ", types);
    }

    private static String describe(List<MissingRequirement> missing) {
        return missing.stream().map(MissingRequirement::getValue).collect(Collectors.joining(", "));
    }

    private static EnforcementAction action(ActionType type, Severity severity, String message,
                                            String requiredAction, Instant deadline, Instant now) {
        return new EnforcementAction(UUID.randomUUID().toString(), type, severity, message, requiredAction,
            deadline, ActionStatus.PENDING, now, null, null);
    }
}
