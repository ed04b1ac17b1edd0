package com.rentalrisk.regulation;

import com.rentalrisk.error.DependencyException;
import com.rentalrisk.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static com.rentalrisk.regulation.RegulationFixture.regulation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RegulationComplianceEvaluatorTest {

    private InMemoryRegulationStore store;
    private RegulationComplianceEvaluator evaluator;

    @BeforeEach
    void setUp() {
        store = new InMemoryRegulationStore();
        evaluator = new RegulationComplianceEvaluator(store, RegulationRules.standard());
    }

    @Nested
    @DisplayName("Scenarios")
    class Scenarios {

        @Test
        void insufficientCoverage_failsInsuranceCheck() {
            store.save(regulation("cameras", "RW").insurance("5000").build());
            RegulationCandidate candidate = RegulationCandidate.builder()
                .insurance(true, new BigDecimal("2000"))
                .build();

            RegulationCheckResult result = evaluator.checkCompliance("cameras", "RW", candidate);

            assertFalse(result.check(RegulationCheckType.INSURANCE_REQUIREMENT).passed());
            assertFalse(result.isCompliant());
            assertThat(result.violations()).contains("Insufficient insurance coverage. Minimum required: 5000");
            assertThat(result.recommendations()).contains("Increase coverage to at least 5000");
        }

        @Test
        void licenseHeld_passesWithoutStatedType() {
            store.save(regulation("excavators", "RW").license("heavy-equipment").build());
            RegulationCandidate candidate = RegulationCandidate.builder()
                .license(true, null)
                .build();

            RegulationCheckResult result = evaluator.checkCompliance("excavators", "RW", candidate);

            assertTrue(result.check(RegulationCheckType.LICENSE_REQUIREMENT).passed());
            assertTrue(result.isCompliant());
            assertTrue(result.violations().isEmpty());
        }

        @Test
        void noRegulationOnFile_isVacuouslyCompliant() {
            RegulationCheckResult result = evaluator.checkCompliance("kayaks", "KE",
                RegulationCandidate.builder().build());

            assertFalse(result.regulationExists());
            assertTrue(result.isCompliant());
            assertFalse(result.warnings().isEmpty());
            assertEquals(RegulationCheckType.values().length, result.checks().size());
        }
    }

    @Nested
    @DisplayName("Individual checks")
    class IndividualChecks {

        @Test
        void categoryNotAllowed() {
            store.save(regulation("drones", "RW").notAllowed().build());
            RegulationCheckResult result = evaluator.checkCompliance("drones", "RW",
                RegulationCandidate.builder().build());
            assertFalse(result.check(RegulationCheckType.IS_ALLOWED).passed());
            assertThat(result.violations()).containsExactly("Category is not allowed in this country");
        }

        @Test
        void underAgeFails_missingAgeWarns() {
            store.save(regulation("vehicles", "RW").minAge(21).build());

            RegulationCheckResult young = evaluator.checkCompliance("vehicles", "RW",
                RegulationCandidate.builder().userAge(19).build());
            assertFalse(young.isCompliant());
            assertThat(young.violations()).containsExactly("User must be at least 21 years old");

            RegulationCheckResult unknown = evaluator.checkCompliance("vehicles", "RW",
                RegulationCandidate.builder().build());
            assertTrue(unknown.isCompliant());
            assertThat(unknown.warnings()).anyMatch(w -> w.contains("age"));
        }

        @Test
        void wrongLicenseTypeFails() {
            store.save(regulation("excavators", "RW").license("heavy-equipment").build());
            RegulationCheckResult result = evaluator.checkCompliance("excavators", "RW",
                RegulationCandidate.builder().license(true, "motorcycle").build());

            assertFalse(result.isCompliant());
            assertEquals("License type must be: heavy-equipment",
                result.check(RegulationCheckType.LICENSE_REQUIREMENT).message());
            assertThat(result.recommendations()).contains("Obtain a heavy-equipment license");
        }

        @Test
        void noLicenseFails() {
            store.save(regulation("excavators", "RW").license(null).build());
            RegulationCheckResult result = evaluator.checkCompliance("excavators", "RW",
                RegulationCandidate.builder().license(false, null).build());
            assertThat(result.violations()).containsExactly("Valid license is required");
        }

        @Test
        void rentalLongerThanMaximumFails() {
            store.save(regulation("boats", "RW").maxRentalDays(7).build());
            RegulationCheckResult result = evaluator.checkCompliance("boats", "RW",
                RegulationCandidate.builder().rentalDurationDays(10).build());
            assertFalse(result.check(RegulationCheckType.RENTAL_DURATION).passed());
            assertThat(result.recommendations()).contains("Maximum rental period is 7 days");
        }

        @Test
        void uninsuredFails() {
            store.save(regulation("boats", "RW").insurance(null).build());
            RegulationCheckResult result = evaluator.checkCompliance("boats", "RW",
                RegulationCandidate.builder().insurance(false, null).build());
            assertThat(result.violations()).containsExactly("Insurance coverage is mandatory");
        }

        @Test
        void backgroundCheckMustBeApproved() {
            store.save(regulation("firearms", "RW").backgroundCheck().build());
            assertFalse(evaluator.checkCompliance("firearms", "RW",
                RegulationCandidate.builder().backgroundCheckStatus(BackgroundCheckStatus.PENDING).build())
                .isCompliant());
            assertTrue(evaluator.checkCompliance("firearms", "RW",
                RegulationCandidate.builder().backgroundCheckStatus(BackgroundCheckStatus.APPROVED).build())
                .isCompliant());
        }

        @Test
        void missingDocumentsAreListed() {
            store.save(regulation("vehicles", "RW").documentation("government_id", "driver_license").build());
            RegulationCheckResult result = evaluator.checkCompliance("vehicles", "RW",
                RegulationCandidate.builder().documentationProvided(List.of("government_id")).build());

            SubCheck documentation = result.check(RegulationCheckType.DOCUMENTATION);
            assertFalse(documentation.passed());
            assertEquals(List.of("driver_license"), documentation.context().get("missing"));
            assertThat(result.violations()).containsExactly("Missing required documents: driver_license");
        }

        @Test
        void seasonalRestrictionForCandidateSeasonFails() {
            SeasonalRestriction rainy = new SeasonalRestriction(3, null, null, null,
                List.of("life_jacket"), true, null, null);
            store.save(regulation("kayaks", "KE").seasonal("rainy", rainy).build());

            RegulationCheckResult rainySeason = evaluator.checkCompliance("kayaks", "KE",
                RegulationCandidate.builder().season("Rainy").build());
            assertFalse(rainySeason.check(RegulationCheckType.SEASONAL_RESTRICTIONS).passed());
            assertThat(rainySeason.violations().get(0)).startsWith("Seasonal restrictions apply for Rainy");

            RegulationCheckResult drySeason = evaluator.checkCompliance("kayaks", "KE",
                RegulationCandidate.builder().season("dry").build());
            assertTrue(drySeason.isCompliant());
        }

        @Test
        void unimposedRequirementsAreNotApplicable() {
            store.save(regulation("books", "RW").build());
            RegulationCheckResult result = evaluator.checkCompliance("books", "RW",
                RegulationCandidate.builder().build());

            assertTrue(result.regulationExists());
            assertEquals(1, result.applicableCount());
            assertFalse(result.check(RegulationCheckType.LICENSE_REQUIREMENT).applicable());
            assertTrue(result.check(RegulationCheckType.LICENSE_REQUIREMENT).passed());
        }
    }

    @Test
    void everyCheckRunsEvenAfterAFailure() {
        store.save(regulation("drones", "RW")
            .notAllowed()
            .minAge(18)
            .documentation("pilot_certificate")
            .backgroundCheck()
            .build());

        RegulationCheckResult result = evaluator.checkCompliance("drones", "RW",
            RegulationCandidate.builder().userAge(16).build());

        assertEquals(4, result.violations().size());
        assertEquals(RegulationCheckType.values().length, result.checks().size());
    }

    @Test
    void compliantIffEveryApplicableCheckPassed() {
        store.save(regulation("vehicles", "RW")
            .minAge(18).license("driver").insurance("1000").documentation("government_id")
            .level(RegulationComplianceLevel.HIGH)
            .build());
        List<RegulationCandidate> candidates = List.of(
            RegulationCandidate.builder().build(),
            RegulationCandidate.builder().userAge(30).license(true, "driver")
                .insurance(true, new BigDecimal("1500")).documentationProvided(List.of("government_id")).build(),
            RegulationCandidate.builder().userAge(17).license(true, "driver")
                .insurance(true, new BigDecimal("1500")).documentationProvided(List.of("government_id")).build(),
            RegulationCandidate.builder().userAge(30).license(true, "truck").build());

        for (RegulationCandidate candidate : candidates) {
            RegulationCheckResult result = evaluator.checkCompliance("vehicles", "RW", candidate);
            boolean allApplicablePassed = result.checks().values().stream()
                .filter(SubCheck::applicable)
                .allMatch(SubCheck::passed);
            assertEquals(allApplicablePassed, result.isCompliant());
            assertEquals(result.isCompliant(), result.violations().isEmpty());
        }
    }

    @Test
    void generalRecommendationsFollowTheRegulation() {
        store.save(regulation("excavators", "RW")
            .level(RegulationComplianceLevel.CRITICAL)
            .notes("Operator on site", "Night use")
            .build());
        RegulationCheckResult result = evaluator.checkCompliance("excavators", "RW",
            RegulationCandidate.builder().build());
        assertThat(result.recommendations()).contains(
            "Special requirements: Operator on site",
            "Prohibited activities: Night use");
        assertThat(result.recommendations()).anyMatch(r -> r.contains("high compliance requirements"));
    }

    @Test
    void invalidCandidateIsRejected() {
        ValidationException ex = assertThrows(ValidationException.class,
            () -> evaluator.checkCompliance(null, "RW",
                RegulationCandidate.builder().userAge(130).insurance(true, new BigDecimal("-1")).build()));
        assertThat(ex.getFieldErrors()).extracting(ValidationException.FieldError::field)
            .containsExactlyInAnyOrder("category_id", "user_age", "coverage_amount");
    }

    @Test
    void blankDocumentEntryIsRejected() {
        RegulationCandidate candidate = RegulationCandidate.builder()
            .userAge(30)
            .documentationProvided(Arrays.asList("government_id", null))
            .build();

        ValidationException ex = assertThrows(ValidationException.class,
            () -> evaluator.checkCompliance("heavy-equipment", "RW", candidate));

        assertThat(ex.getFieldErrors()).extracting(ValidationException.FieldError::field)
            .containsExactly("documentation_provided");
    }

    @Test
    void storeFailureIsADependencyError() {
        RegulationStore failing = mock(RegulationStore.class);
        when(failing.find(any(), any())).thenThrow(new IllegalStateException("connection refused"));
        RegulationComplianceEvaluator broken = new RegulationComplianceEvaluator(failing, RegulationRules.standard());

        assertThrows(DependencyException.class,
            () -> broken.checkCompliance("cameras", "RW", RegulationCandidate.builder().build()));
    }
}
