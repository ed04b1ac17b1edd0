package com.rentalrisk;

import com.rentalrisk.compliance.ComplianceStateTracker;
import com.rentalrisk.compliance.InMemoryComplianceCheckStore;
import com.rentalrisk.config.RiskEngineProperties;
import com.rentalrisk.enforcement.ActionDispatcher;
import com.rentalrisk.enforcement.BookingBlocker;
import com.rentalrisk.enforcement.EnforcementDecisionEngine;
import com.rentalrisk.enforcement.EnforcementService;
import com.rentalrisk.enforcement.NotificationDispatcher;
import com.rentalrisk.enforcement.RequirementEnforcer;
import com.rentalrisk.facts.InMemoryRentalFactsProvider;
import com.rentalrisk.facts.RuleFactsService;
import com.rentalrisk.management.RiskManagementService;
import com.rentalrisk.profile.InMemoryRiskProfileStore;
import com.rentalrisk.profile.RiskProfileService;
import com.rentalrisk.profile.RiskProfileValidator;
import com.rentalrisk.regulation.InMemoryRegulationStore;
import com.rentalrisk.regulation.RegulationComplianceEvaluator;
import com.rentalrisk.regulation.RegulationRules;
import com.rentalrisk.scoring.InMemoryAssessmentHistory;
import com.rentalrisk.scoring.RiskAssessmentService;
import com.rentalrisk.scoring.ScoringConfiguration;
import com.rentalrisk.violation.InMemoryViolationStore;
import com.rentalrisk.violation.PenaltyPolicy;
import com.rentalrisk.violation.ViolationLedger;

import static org.mockito.Mockito.mock;

/**
 * The engine wired by hand around in-memory stores, a movable clock and
 * mock execution collaborators.
 */
public class TestEngine {

    public final MutableClock clock = new MutableClock(TestFixtures.NOW);
    public final RiskEngineProperties properties = TestFixtures.properties();
    public final InMemoryRentalFactsProvider facts = new InMemoryRentalFactsProvider();
    public final InMemoryRegulationStore regulationStore = new InMemoryRegulationStore();

    public final NotificationDispatcher notifications = mock(NotificationDispatcher.class);
    public final BookingBlocker bookingBlocker = mock(BookingBlocker.class);
    public final RequirementEnforcer requirementEnforcer = mock(RequirementEnforcer.class);

    public final RuleFactsService factsService = new RuleFactsService(facts);
    public final RiskProfileService profiles =
        new RiskProfileService(new InMemoryRiskProfileStore(), new RiskProfileValidator(), factsService, clock);
    public final RegulationComplianceEvaluator regulations =
        new RegulationComplianceEvaluator(regulationStore, RegulationRules.standard());
    public final RiskAssessmentService assessments;
    public final ComplianceStateTracker tracker;
    public final ViolationLedger ledger;
    public final EnforcementService enforcement;
    public final RiskManagementService management;

    public TestEngine() {
        ScoringConfiguration scoring = new ScoringConfiguration();
        assessments = new RiskAssessmentService(
            scoring.riskScoringEngine(properties),
            scoring.recommendationPolicy(properties),
            factsService, profiles, new InMemoryAssessmentHistory(), properties, clock);
        tracker = new ComplianceStateTracker(
            new InMemoryComplianceCheckStore(), profiles, factsService, regulations, properties, clock);
        ledger = new ViolationLedger(new InMemoryViolationStore(), new PenaltyPolicy(properties), clock);
        enforcement = new EnforcementService(tracker, profiles, factsService, new EnforcementDecisionEngine(),
            new ActionDispatcher(notifications, bookingBlocker, requirementEnforcer, clock), ledger, clock);
        management = new RiskManagementService(profiles, assessments, regulations, tracker, enforcement, ledger);
    }
}
