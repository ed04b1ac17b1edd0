package com.rentalrisk.enforcement;

import com.rentalrisk.compliance.ComplianceCheck;
import com.rentalrisk.compliance.ComplianceStatus;
import com.rentalrisk.compliance.MissingRequirement;
import com.rentalrisk.profile.EnforcementLevel;
import com.rentalrisk.profile.MandatoryRequirements;
import com.rentalrisk.profile.RiskLevel;
import com.rentalrisk.profile.RiskProfile;
import com.rentalrisk.violation.ViolationType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class EnforcementDecisionEngineTest {

    private static final Instant NOW = Instant.parse("2025-06-15T10:00:00Z");

    private final EnforcementDecisionEngine engine = new EnforcementDecisionEngine();

    @Nested
    @DisplayName("Non-compliant bookings")
    class NonCompliant {

        @Test
        void lenientOnlyNotifies() {
            EnforcementPlan plan = engine.decide(nonCompliant(MissingRequirement.MISSING_INSURANCE),
                profile(EnforcementLevel.LENIENT, 0), NOW);

            assertThat(plan.actions()).extracting(EnforcementAction::type)
                .containsExactly(ActionType.SEND_NOTIFICATION);
            assertEquals(Severity.LOW, plan.actions().get(0).severity());
            assertTrue(plan.violationTypes().isEmpty());
        }

        @Test
        void moderateAddsRemediesWithDeadline() {
            EnforcementPlan plan = engine.decide(
                nonCompliant(MissingRequirement.MISSING_INSURANCE, MissingRequirement.INADEQUATE_COVERAGE,
                    MissingRequirement.MISSING_INSPECTION),
                profile(EnforcementLevel.MODERATE, 0), NOW);

            assertThat(plan.actions()).extracting(EnforcementAction::type).containsExactly(
                ActionType.SEND_NOTIFICATION, ActionType.REQUIRE_INSURANCE, ActionType.REQUIRE_INSPECTION);
            assertThat(plan.actions()).allMatch(a -> a.severity() == Severity.MEDIUM);
            assertEquals(NOW.plus(Duration.ofHours(36)), plan.actions().get(1).deadline());
            assertEquals(List.of(ViolationType.MISSING_INSURANCE, ViolationType.INADEQUATE_COVERAGE,
                ViolationType.MISSING_INSPECTION), plan.violationTypes());
            assertEquals(Severity.MEDIUM, plan.violationSeverity());
            assertFalse(plan.escalateViolations());
        }

        @Test
        void strictBlocksTheBooking() {
            EnforcementPlan plan = engine.decide(nonCompliant(MissingRequirement.MISSING_INSURANCE),
                profile(EnforcementLevel.STRICT, 0), NOW);

            assertThat(plan.actions()).extracting(EnforcementAction::type).containsExactly(
                ActionType.SEND_NOTIFICATION, ActionType.REQUIRE_INSURANCE, ActionType.BLOCK_BOOKING);
            assertThat(plan.actions()).allMatch(a -> a.severity() == Severity.HIGH);
            assertThat(plan.actions()).allMatch(EnforcementAction::isPending);
        }

        @Test
        void veryStrictEscalatesEverything() {
            EnforcementPlan plan = engine.decide(nonCompliant(MissingRequirement.MISSING_INSURANCE),
                profile(EnforcementLevel.VERY_STRICT, 0), NOW);

            assertThat(plan.actions()).extracting(EnforcementAction::type).containsExactly(
                ActionType.SEND_NOTIFICATION, ActionType.REQUIRE_INSURANCE, ActionType.BLOCK_BOOKING,
                ActionType.ESCALATE);
            assertThat(plan.actions()).allMatch(a -> a.severity() == Severity.CRITICAL);
            assertEquals(Severity.CRITICAL, plan.violationSeverity());
            assertTrue(plan.escalateViolations());
        }

        @Test
        void regulatoryGapHasNoRemedyOrLedgerType() {
            EnforcementPlan plan = engine.decide(nonCompliant(MissingRequirement.REGULATORY_NONCOMPLIANCE),
                profile(EnforcementLevel.STRICT, 0), NOW);

            assertThat(plan.actions()).extracting(EnforcementAction::type)
                .containsExactly(ActionType.SEND_NOTIFICATION, ActionType.BLOCK_BOOKING);
            assertTrue(plan.violationTypes().isEmpty());
        }

        @Test
        void lapsedGraceIsRecordedAsExpiredCompliance() {
            ComplianceCheck lapsed = check(ComplianceStatus.NON_COMPLIANT, NOW.minus(Duration.ofHours(1)),
                MissingRequirement.MISSING_INSURANCE);

            EnforcementPlan plan = engine.decide(lapsed, profile(EnforcementLevel.STRICT, 24), NOW);

            assertEquals(List.of(ViolationType.EXPIRED_COMPLIANCE), plan.violationTypes());
        }
    }

    @Nested
    @DisplayName("Grace period reminders")
    class Grace {

        @Test
        void reminderCarriesTheGraceDeadline() {
            Instant endsAt = NOW.plus(Duration.ofHours(40));
            EnforcementPlan plan = engine.decide(
                check(ComplianceStatus.GRACE_PERIOD, endsAt, MissingRequirement.MISSING_INSURANCE),
                profile(EnforcementLevel.VERY_STRICT, 48), NOW);

            assertEquals(1, plan.actions().size());
            EnforcementAction reminder = plan.actions().get(0);
            assertEquals(ActionType.SEND_NOTIFICATION, reminder.type());
            assertEquals(Severity.LOW, reminder.severity());
            assertEquals(endsAt, reminder.deadline());
            assertTrue(plan.violationTypes().isEmpty());
        }

        @Test
        void severityRisesAsDeadlineNears() {
            Instant endsAt = NOW.plus(Duration.ofHours(48));
            assertEquals(Severity.LOW, EnforcementDecisionEngine.graceSeverity(endsAt, 48, NOW));
            assertEquals(Severity.LOW, EnforcementDecisionEngine.graceSeverity(endsAt, 48, NOW.plus(Duration.ofHours(24))));
            assertEquals(Severity.MEDIUM, EnforcementDecisionEngine.graceSeverity(endsAt, 48, NOW.plus(Duration.ofHours(30))));
            assertEquals(Severity.HIGH, EnforcementDecisionEngine.graceSeverity(endsAt, 48, NOW.plus(Duration.ofHours(40))));
            assertEquals(Severity.HIGH, EnforcementDecisionEngine.graceSeverity(endsAt, 48, NOW.plus(Duration.ofHours(50))));
        }
    }

    @ParameterizedTest
    @EnumSource(value = ComplianceStatus.class, names = {"COMPLIANT", "EXEMPT", "PENDING"})
    void settledStatusesNeedNothing(ComplianceStatus status) {
        EnforcementPlan plan = engine.decide(check(status, null), profile(EnforcementLevel.VERY_STRICT, 0), NOW);
        assertTrue(plan.actions().isEmpty());
        assertTrue(plan.violationTypes().isEmpty());
    }

    private static ComplianceCheck nonCompliant(MissingRequirement... missing) {
        return check(ComplianceStatus.NON_COMPLIANT, null, missing);
    }

    private static ComplianceCheck check(ComplianceStatus status, Instant graceEndsAt, MissingRequirement... missing) {
        return new ComplianceCheck("b-1", "p-1", "r-1", missing.length == 0, List.of(missing), List.of(), 0,
            status, graceEndsAt, List.of(), NOW, NOW, null, null);
    }

    private static RiskProfile profile(EnforcementLevel level, int graceHours) {
        MandatoryRequirements requirements =
            new MandatoryRequirements(true, true, new BigDecimal("1000"), List.of("pre_rental"), 36);
        return new RiskProfile("rp-1", "p-1", "tools", RiskLevel.HIGH, requirements, List.of(), List.of(),
            level, true, graceHours, false, NOW, NOW);
    }
}
