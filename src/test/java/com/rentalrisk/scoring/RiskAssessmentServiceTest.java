package com.rentalrisk.scoring;

import com.rentalrisk.TestEngine;
import com.rentalrisk.TestFixtures;
import com.rentalrisk.compliance.ComplianceStatus;
import com.rentalrisk.error.NotFoundException;
import com.rentalrisk.error.ValidationException;
import com.rentalrisk.facts.BookingFacts;
import com.rentalrisk.facts.BookingStatus;
import com.rentalrisk.facts.CategoryNorms;
import com.rentalrisk.facts.RenterFacts;
import com.rentalrisk.profile.EnforcementLevel;
import com.rentalrisk.profile.MandatoryRequirements;
import com.rentalrisk.profile.RiskLevel;
import com.rentalrisk.profile.RiskProfileDraft;
import com.rentalrisk.profile.RiskProfilePatch;
import com.rentalrisk.support.BatchResult;
import com.rentalrisk.support.PageQuery;
import com.rentalrisk.support.PagedResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class RiskAssessmentServiceTest {

    private TestEngine engine;

    @BeforeEach
    void setUp() {
        engine = new TestEngine();
        engine.facts.putProduct(TestFixtures.product("prod-1", "tools"));
        engine.facts.putRenter(TestFixtures.adultRenter("renter-1"));
    }

    @Test
    void unknownProductOrRenterIsNotFound() {
        assertThrows(NotFoundException.class,
            () -> engine.assessments.assess(AssessmentRequest.of("nope", "renter-1", null)));
        assertThrows(NotFoundException.class,
            () -> engine.assessments.assess(AssessmentRequest.of("prod-1", "nope", null)));
    }

    @Test
    void missingIdsAreRejected() {
        ValidationException ex = assertThrows(ValidationException.class,
            () -> engine.assessments.assess(AssessmentRequest.of(null, " ", null)));
        assertEquals(2, ex.getFieldErrors().size());
    }

    @Test
    void productWithoutProfileIsStillAssessed() {
        RiskAssessment assessment = engine.assessments.assess(AssessmentRequest.of("prod-1", "renter-1", null));

        assertEquals(38, assessment.riskFactors().productRisk());
        assertEquals(MandatoryRequirements.none(), assessment.mandatoryRequirements());
        assertEquals(ComplianceStatus.PENDING, assessment.complianceStatus());
        assertThat(assessment.recommendations()).anyMatch(r -> r.contains("create one"));
        assertEquals(assessment.assessmentDate().plus(Duration.ofHours(24)), assessment.expiresAt());
        assertTrue(assessment.expiresAt().isAfter(assessment.assessmentDate()));
    }

    @Test
    void assessmentCopiesProfileRequirements() {
        MandatoryRequirements requirements = TestFixtures.insuranceOnly();
        engine.profiles.create(TestFixtures.draft("prod-1", "tools", RiskLevel.MEDIUM, requirements,
            null, false, 0));

        RiskAssessment assessment = engine.assessments.assess(AssessmentRequest.of("prod-1", "renter-1", null));

        assertEquals(requirements, assessment.mandatoryRequirements());
        assertEquals(38, assessment.riskFactors().productRisk());
        // 38*0.40 + 20*0.25 + 50*0.20 + 0 = 30.2
        assertEquals(30, assessment.overallRiskScore());
        assertEquals(RiskLevel.LOW, assessment.riskLevel());
    }

    @Test
    void exemptProductIsProvisionallyExempt() {
        engine.profiles.create(TestFixtures.draft("prod-1", "tools", RiskLevel.LOW, null, null, false, 0));
        engine.profiles.update("prod-1", RiskProfilePatch.exemption(true));

        RiskAssessment assessment = engine.assessments.assess(AssessmentRequest.of("prod-1", "renter-1", null));
        assertEquals(ComplianceStatus.EXEMPT, assessment.complianceStatus());
    }

    @Test
    void highRiskTriggersRecommendations() {
        engine.facts.putCategoryNorms(new CategoryNorms("tools", 3, new BigDecimal("100")));
        engine.facts.putRenter(new RenterFacts("renter-risky", false, false,
            TestFixtures.NOW.minus(Duration.ofDays(5)), 0, 3, null, false, null, null, List.of()));
        engine.facts.putBooking(new BookingFacts("booking-big", "prod-1", "renter-risky",
            LocalDate.of(2025, 7, 1), LocalDate.of(2025, 7, 20), new BigDecimal("2500"),
            null, null, BookingStatus.CONFIRMED, null, Set.of()));
        engine.profiles.create(new RiskProfileDraft("prod-1", "tools", RiskLevel.CRITICAL,
            TestFixtures.insuranceOnly(), List.of("a", "b", "c", "d", "e"), List.of(),
            EnforcementLevel.VERY_STRICT, true, 0));

        RiskAssessment assessment = engine.assessments.assess(
            AssessmentRequest.of("prod-1", "renter-risky", "booking-big"));

        assertEquals(100, assessment.riskFactors().productRisk());
        assertEquals(100, assessment.riskFactors().renterRisk());
        assertEquals(100, assessment.riskFactors().bookingRisk());
        assertEquals(85, assessment.overallRiskScore());
        assertEquals(RiskLevel.CRITICAL, assessment.riskLevel());
        assertThat(assessment.recommendations()).contains(
            "Pre-rental inspection mandatory",
            "Consider additional security deposit",
            "Enhanced user verification recommended",
            "Monitor for potential disputes");
        assertThat(assessment.recommendations()).anyMatch(r -> r.startsWith("Require a mandatory inspection"));
        // insurance is already required by the profile
        assertThat(assessment.recommendations()).doesNotContain("Mandatory insurance coverage required");
    }

    @Test
    void recommendationsCanBeSuppressed() {
        RiskAssessment assessment = engine.assessments.assess(
            new AssessmentRequest("prod-1", "renter-1", null, false));
        assertTrue(assessment.recommendations().isEmpty());
    }

    @Test
    void bookingMustBelongToProductAndRenter() {
        engine.facts.putBooking(TestFixtures.uninsuredBooking("booking-x", "other-product", "renter-1"));
        assertThrows(ValidationException.class,
            () -> engine.assessments.assess(AssessmentRequest.of("prod-1", "renter-1", "booking-x")));
    }

    @Test
    void bulkAssessReportsEveryItem() {
        List<AssessmentRequest> requests = Arrays.asList(
            AssessmentRequest.of("prod-1", "renter-1", null),
            AssessmentRequest.of("prod-1", "ghost", null),
            AssessmentRequest.of(null, "renter-1", null),
            AssessmentRequest.of("prod-1", "renter-1", null));

        BatchResult<RiskAssessment> result = engine.assessments.bulkAssess(requests);

        assertEquals(2, result.successful());
        assertEquals(2, result.failed());
        assertEquals(requests.size(), result.successful() + result.failed());
        assertEquals(2, result.results().size());
        assertEquals(List.of(1, 2), result.errors().stream().map(BatchResult.BatchError::index).toList());
        assertEquals("NOT_FOUND", result.errors().get(0).errorCode());
        assertEquals("VALIDATION_FAILED", result.errors().get(1).errorCode());
    }

    @Test
    void historyFeedsAverageScore() {
        assertEquals(0.0, engine.assessments.averageRiskScore());
        RiskAssessment first = engine.assessments.assess(AssessmentRequest.of("prod-1", "renter-1", null));
        engine.assessments.assess(AssessmentRequest.of("prod-1", "renter-1", null));

        assertEquals(first.overallRiskScore(), engine.assessments.averageRiskScore(), 1e-9);
        assertEquals(2, engine.assessments.listAssessments(AssessmentFilter.forProduct("prod-1"),
            PageQuery.firstPage()).total());
    }

    @Test
    void recordedAssessmentCanBeFetchedById() {
        RiskAssessment assessment = engine.assessments.assess(AssessmentRequest.of("prod-1", "renter-1", null));

        assertEquals(assessment, engine.assessments.getAssessment(assessment.id()));
        assertThrows(NotFoundException.class, () -> engine.assessments.getAssessment("no-such-assessment"));
    }

    @Test
    void listingFiltersAndPutsNewestFirst() {
        engine.facts.putRenter(TestFixtures.adultRenter("renter-2"));
        RiskAssessment oldest = engine.assessments.assess(AssessmentRequest.of("prod-1", "renter-1", null));
        engine.clock.advance(Duration.ofMinutes(5));
        RiskAssessment other = engine.assessments.assess(AssessmentRequest.of("prod-1", "renter-2", null));
        engine.clock.advance(Duration.ofMinutes(5));
        RiskAssessment newest = engine.assessments.assess(AssessmentRequest.of("prod-1", "renter-1", null));

        PagedResult<RiskAssessment> all = engine.assessments.listAssessments(AssessmentFilter.any(), PageQuery.firstPage());
        assertEquals(List.of(newest, other, oldest), all.items());

        PagedResult<RiskAssessment> renterOne = engine.assessments.listAssessments(
            new AssessmentFilter(null, "renter-1", null, null, null), PageQuery.firstPage());
        assertEquals(List.of(newest, oldest), renterOne.items());

        PagedResult<RiskAssessment> byLevel = engine.assessments.listAssessments(
            new AssessmentFilter("prod-1", null, null, oldest.riskLevel(), ComplianceStatus.PENDING),
            PageQuery.firstPage());
        assertThat(byLevel.items()).contains(oldest);
        assertTrue(engine.assessments.listAssessments(
            new AssessmentFilter(null, null, "booking-x", null, null), PageQuery.firstPage()).items().isEmpty());

        PagedResult<RiskAssessment> second = engine.assessments.listAssessments(AssessmentFilter.any(), new PageQuery(2, 2));
        assertEquals(List.of(oldest), second.items());
        assertEquals(3, second.total());
        assertEquals(2, second.totalPages());
    }
}
