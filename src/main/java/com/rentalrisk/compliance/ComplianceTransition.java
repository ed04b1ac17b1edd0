package com.rentalrisk.compliance;

import java.time.Duration;
import java.time.Instant;

/**
 * Next status of a booking's compliance state machine.
 *
 * <pre>
 * (new|pending|compliant) --non-compliant, grace hours &gt; 0--&gt; grace_period
 * (new|pending|compliant) --non-compliant, no grace--&gt; non_compliant
 * grace_period --non-compliant, deadline passed--&gt; non_compliant
 * any --compliant--&gt; compliant
 * any --exempt (profile flag or granted exemption)--&gt; exempt
 * </pre>
 *
 * A non_compliant booking stays there until remediated, so it never
 * re-enters grace_period within the same episode.
 */
public record ComplianceTransition(ComplianceStatus status, Instant gracePeriodEndsAt) {

    public static ComplianceTransition next(ComplianceCheck current,
                                            boolean compliant,
                                            boolean exempt,
                                            int gracePeriodHours,
                                            Instant now) {
        ComplianceStatus currentStatus = current == null ? ComplianceStatus.PENDING : current.status();
        Instant endsAt = current == null ? null : current.gracePeriodEndsAt();

        boolean grantedExemption = current != null && current.exemptedBy() != null;
        if (exempt || grantedExemption) {
            return new ComplianceTransition(ComplianceStatus.EXEMPT, endsAt);
        }
        if (compliant) {
            return new ComplianceTransition(ComplianceStatus.COMPLIANT, null);
        }
        switch (currentStatus) {
            case GRACE_PERIOD:
                if (endsAt == null || now.isAfter(endsAt)) {
                    return new ComplianceTransition(ComplianceStatus.NON_COMPLIANT, endsAt);
                }
                return new ComplianceTransition(ComplianceStatus.GRACE_PERIOD, endsAt);
            case NON_COMPLIANT:
                return new ComplianceTransition(ComplianceStatus.NON_COMPLIANT, endsAt);
            default:
                if (gracePeriodHours > 0) {
                    return new ComplianceTransition(ComplianceStatus.GRACE_PERIOD,
                        now.plus(Duration.ofHours(gracePeriodHours)));
                }
                return new ComplianceTransition(ComplianceStatus.NON_COMPLIANT, null);
        }
    }
}
