package com.rentalrisk.management;

import com.rentalrisk.compliance.ComplianceCheck;
import com.rentalrisk.compliance.ComplianceFilter;
import com.rentalrisk.compliance.ComplianceRequest;
import com.rentalrisk.compliance.ComplianceStateTracker;
import com.rentalrisk.compliance.ComplianceStatus;
import com.rentalrisk.enforcement.ActionStatus;
import com.rentalrisk.enforcement.EnforcementAction;
import com.rentalrisk.enforcement.EnforcementResult;
import com.rentalrisk.enforcement.EnforcementService;
import com.rentalrisk.management.RiskManagementStats.EnforcementActionStats;
import com.rentalrisk.management.RiskManagementStats.RiskDistribution;
import com.rentalrisk.profile.RiskLevel;
import com.rentalrisk.profile.RiskProfile;
import com.rentalrisk.profile.RiskProfileDraft;
import com.rentalrisk.profile.RiskProfileFilter;
import com.rentalrisk.profile.RiskProfilePatch;
import com.rentalrisk.profile.RiskProfileService;
import com.rentalrisk.regulation.RegulationCandidate;
import com.rentalrisk.regulation.RegulationCheckResult;
import com.rentalrisk.regulation.RegulationComplianceEvaluator;
import com.rentalrisk.scoring.AssessmentFilter;
import com.rentalrisk.scoring.AssessmentRequest;
import com.rentalrisk.scoring.RiskAssessment;
import com.rentalrisk.scoring.RiskAssessmentService;
import com.rentalrisk.support.BatchResult;
import com.rentalrisk.support.PageQuery;
import com.rentalrisk.support.PagedResult;
import com.rentalrisk.violation.PolicyViolation;
import com.rentalrisk.violation.ViolationDraft;
import com.rentalrisk.violation.ViolationFilter;
import com.rentalrisk.violation.ViolationLedger;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Entry point of the engine: every operation the marketplace calls goes
 * through here.
 */
@Service
public class RiskManagementService {

    private final RiskProfileService profiles;
    private final RiskAssessmentService assessments;
    private final RegulationComplianceEvaluator regulations;
    private final ComplianceStateTracker compliance;
    private final EnforcementService enforcement;
    private final ViolationLedger violations;

    public RiskManagementService(RiskProfileService profiles,
                                 RiskAssessmentService assessments,
                                 RegulationComplianceEvaluator regulations,
                                 ComplianceStateTracker compliance,
                                 EnforcementService enforcement,
                                 ViolationLedger violations) {
        this.profiles = profiles;
        this.assessments = assessments;
        this.regulations = regulations;
        this.compliance = compliance;
        this.enforcement = enforcement;
        this.violations = violations;
    }

    // profiles

    public RiskProfile createRiskProfile(RiskProfileDraft draft) {
        return profiles.create(draft);
    }

    public RiskProfile getRiskProfileByProduct(String productId) {
        return profiles.requireByProduct(productId);
    }

    public RiskProfile updateRiskProfile(String productId, RiskProfilePatch patch) {
        return profiles.update(productId, patch);
    }

    public PagedResult<RiskProfile> listRiskProfiles(RiskProfileFilter filter, PageQuery page) {
        return profiles.list(filter, page);
    }

    public BatchResult<RiskProfile> bulkCreateRiskProfiles(List<RiskProfileDraft> drafts) {
        return profiles.bulkCreate(drafts);
    }

    // assessment

    public RiskAssessment assessRisk(AssessmentRequest request) {
        return assessments.assess(request);
    }

    public BatchResult<RiskAssessment> bulkAssessRisk(List<AssessmentRequest> requests) {
        return assessments.bulkAssess(requests);
    }

    public RiskAssessment getRiskAssessment(String assessmentId) {
        return assessments.getAssessment(assessmentId);
    }

    public PagedResult<RiskAssessment> getRiskAssessments(AssessmentFilter filter, PageQuery page) {
        return assessments.listAssessments(filter, page);
    }

    // compliance

    public ComplianceCheck checkCompliance(ComplianceRequest request) {
        return compliance.checkCompliance(request);
    }

    public ComplianceCheck getComplianceStatus(String bookingId) {
        return compliance.getComplianceStatus(bookingId);
    }

    public PagedResult<ComplianceCheck> listComplianceChecks(ComplianceFilter filter, PageQuery page) {
        return compliance.listComplianceChecks(filter, page);
    }

    public ComplianceCheck grantExemption(String bookingId, String actor, String reason) {
        return compliance.grantExemption(bookingId, actor, reason);
    }

    public RegulationCheckResult checkCategoryRegulationCompliance(String categoryId,
                                                                   String countryId,
                                                                   RegulationCandidate candidate) {
        return regulations.checkCompliance(categoryId, countryId, candidate);
    }

    // enforcement

    public EnforcementResult triggerEnforcement(String bookingId) {
        return enforcement.triggerEnforcement(bookingId);
    }

    public EnforcementResult approveEnforcementAction(String bookingId, String actionId, String approverId) {
        return enforcement.approveAction(bookingId, actionId, approverId);
    }

    public ComplianceCheck cancelEnforcementAction(String bookingId, String actionId, String reason) {
        return enforcement.cancelAction(bookingId, actionId, reason);
    }

    // violations

    public PolicyViolation recordViolation(ViolationDraft draft) {
        return violations.record(draft);
    }

    public PolicyViolation getViolation(String id) {
        return violations.get(id);
    }

    public PolicyViolation resolveViolation(String id, List<String> resolutionActions, String notes) {
        return violations.resolve(id, resolutionActions, notes);
    }

    public PolicyViolation escalateViolation(String id) {
        return violations.escalate(id);
    }

    public PolicyViolation assessPenalty(String id, BigDecimal amount) {
        return violations.assessPenalty(id, amount);
    }

    public PolicyViolation assignViolation(String id, String inspectorId) {
        return violations.assign(id, inspectorId);
    }

    public PagedResult<PolicyViolation> listViolations(ViolationFilter filter, PageQuery page) {
        return violations.list(filter, page);
    }

    // statistics

    public RiskManagementStats getRiskManagementStats() {
        List<ComplianceCheck> checks = compliance.all();
        long checked = checks.size();
        long compliant = checks.stream().filter(c -> c.status() == ComplianceStatus.COMPLIANT).count();

        Set<String> checkedBookings = checks.stream().map(ComplianceCheck::bookingId).collect(Collectors.toSet());
        long withOpenViolation = violations.all().stream()
            .filter(PolicyViolation::isOpen)
            .map(PolicyViolation::bookingId)
            .filter(checkedBookings::contains)
            .distinct()
            .count();

        Map<ActionStatus, Long> actions = checks.stream()
            .flatMap(c -> c.enforcementActions().stream())
            .collect(Collectors.groupingBy(EnforcementAction::status, Collectors.counting()));
        long totalActions = actions.values().stream().mapToLong(Long::longValue).sum();

        Map<RiskLevel, Long> levels = profiles.all().stream()
            .collect(Collectors.groupingBy(RiskProfile::riskLevel, Collectors.counting()));
        Function<RiskLevel, Long> level = l -> levels.getOrDefault(l, 0L);

        return new RiskManagementStats(
            profiles.count(),
            percentage(compliant, checked),
            percentage(withOpenViolation, checked),
            Math.round(assessments.averageRiskScore()),
            new EnforcementActionStats(
                totalActions,
                actions.getOrDefault(ActionStatus.EXECUTED, 0L),
                actions.getOrDefault(ActionStatus.FAILED, 0L),
                actions.getOrDefault(ActionStatus.PENDING, 0L)),
            new RiskDistribution(
                level.apply(RiskLevel.LOW),
                level.apply(RiskLevel.MEDIUM),
                level.apply(RiskLevel.HIGH),
                level.apply(RiskLevel.CRITICAL))
        );
    }

    private static double percentage(long part, long whole) {
        if (whole == 0) {
            return 0.0;
        }
        return Math.round(part * 10000.0 / whole) / 100.0;
    }
}
