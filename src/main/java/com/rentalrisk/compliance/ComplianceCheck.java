package com.rentalrisk.compliance;

import com.rentalrisk.enforcement.EnforcementAction;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Stored compliance state of one booking.
 *
 * @param gracePeriodEndsAt set when a grace period is granted and kept after it
 *                          lapses, so a non-compliance episode gets one grace
 *                          period at most; cleared once the booking is compliant
 * @param statusChangedAt   start of the current status episode
 */
public record ComplianceCheck(
    String bookingId,
    String productId,
    String renterId,
    boolean compliant,
    List<MissingRequirement> missingRequirements,
    List<String> regulationViolations,
    int complianceScore,
    ComplianceStatus status,
    Instant gracePeriodEndsAt,
    List<EnforcementAction> enforcementActions,
    Instant lastCheckedAt,
    Instant statusChangedAt,
    String exemptedBy,
    String exemptionReason
) {

    public ComplianceCheck {
        missingRequirements = List.copyOf(missingRequirements);
        regulationViolations = List.copyOf(regulationViolations);
        enforcementActions = List.copyOf(enforcementActions);
    }

    public boolean graceExpired(Instant now) {
        return status == ComplianceStatus.GRACE_PERIOD
            && gracePeriodEndsAt != null
            && now.isAfter(gracePeriodEndsAt);
    }

    public Optional<EnforcementAction> findAction(String actionId) {
        return enforcementActions.stream()
            .filter(a -> a.id().equals(actionId))
            .findFirst();
    }

    /** Actions created during the current status episode. */
    public List<EnforcementAction> currentEpisodeActions() {
        return enforcementActions.stream()
            .filter(a -> !a.createdAt().isBefore(statusChangedAt))
            .toList();
    }

    public ComplianceCheck withAppendedActions(List<EnforcementAction> added) {
        List<EnforcementAction> actions = new ArrayList<>(enforcementActions);
        actions.addAll(added);
        return withActions(actions);
    }

    public ComplianceCheck withReplacedAction(EnforcementAction replacement) {
        List<EnforcementAction> actions = enforcementActions.stream()
            .map(a -> a.id().equals(replacement.id()) ? replacement : a)
            .toList();
        return withActions(actions);
    }

    public ComplianceCheck exempted(String actor, String reason, Instant now) {
        return new ComplianceCheck(bookingId, productId, renterId, compliant, missingRequirements,
            regulationViolations, complianceScore, ComplianceStatus.EXEMPT, gracePeriodEndsAt, enforcementActions,
            lastCheckedAt, status == ComplianceStatus.EXEMPT ? statusChangedAt : now, actor, reason);
    }

    private ComplianceCheck withActions(List<EnforcementAction> actions) {
        return new ComplianceCheck(bookingId, productId, renterId, compliant, missingRequirements,
            regulationViolations, complianceScore, status, gracePeriodEndsAt, actions,
            lastCheckedAt, statusChangedAt, exemptedBy, exemptionReason);
    }
}
