package com.rentalrisk.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Typed policy configuration bound from {@code risk-engine.*}.
 *
 * Unknown keys fail binding, so a misspelt weight or threshold stops the
 * application at startup instead of silently falling back to a default.
 */
@Validated
@ConfigurationProperties(prefix = "risk-engine", ignoreUnknownFields = false)
public record RiskEngineProperties(
    @NotNull @Valid Scoring scoring,
    @NotNull @Valid Compliance compliance,
    @NotNull @Valid Penalties penalties,
    @NotNull @Valid Regulations regulations
) {

    public record Scoring(
        @NotNull @Valid Weights weights,
        @NotNull @Valid LevelThresholds levelThresholds,
        @NotNull @Valid ProductScoring product,
        @NotNull @Valid RenterScoring renter,
        @NotNull @Valid BookingScoring booking,
        @NotNull @Valid RecommendationThresholds recommendations,
        @NotNull Duration assessmentValidity
    ) {

        @AssertTrue(message = "assessment-validity must be positive")
        public boolean isAssessmentValidityPositive() {
            return assessmentValidity == null || (!assessmentValidity.isZero() && !assessmentValidity.isNegative());
        }
    }

    /**
     * Share of each sub-score in the overall risk score.
     */
    public record Weights(
        @DecimalMin("0.0") @DecimalMax("1.0") double product,
        @DecimalMin("0.0") @DecimalMax("1.0") double renter,
        @DecimalMin("0.0") @DecimalMax("1.0") double booking,
        @DecimalMin("0.0") @DecimalMax("1.0") double seasonal
    ) {

        @AssertTrue(message = "scoring weights must sum to 1.0")
        public boolean isNormalized() {
            return Math.abs(product + renter + booking + seasonal - 1.0) < 1e-9;
        }
    }

    /**
     * Minimum overall score for each level above low.
     */
    public record LevelThresholds(
        @Min(1) @Max(100) int medium,
        @Min(1) @Max(100) int high,
        @Min(1) @Max(100) int critical
    ) {

        @AssertTrue(message = "level thresholds must be strictly ascending")
        public boolean isAscending() {
            return medium < high && high < critical;
        }
    }

    public record ProductScoring(@Min(0) @Max(100) int factorIncrement) {}

    public record RenterScoring(
        @Min(0) @Max(100) int neutralScore,
        @Min(0) @Max(100) int verifiedCredit,
        @Min(0) @Max(100) int kycCredit,
        @Min(0) @Max(100) int establishedAccountCredit,
        @Min(0) @Max(100) int newAccountPenalty,
        @Min(0) @Max(100) int experiencedRenterCredit,
        @Min(0) @Max(100) int priorViolationPenalty,
        @Min(1) int establishedAccountDays,
        @Min(1) int newAccountDays,
        @Min(1) int experiencedRenterBookings
    ) {}

    public record BookingScoring(@Min(0) @Max(100) int neutralScore) {}

    public record RecommendationThresholds(
        @Min(0) @Max(100) int mandatoryInspectionScore,
        @Min(0) @Max(100) int renterVerificationScore,
        @Min(0) @Max(100) int disputeMonitoringScore
    ) {}

    public record Compliance(@NotNull Duration recheckInterval) {}

    public record Penalties(
        @NotNull @DecimalMin("0") BigDecimal firstViolation,
        @NotNull @DecimalMin("0") BigDecimal repeatViolation,
        @NotNull @DecimalMin("0") BigDecimal criticalViolation
    ) {}

    /**
     * @param catalogLocation Spring resource location of a JSON regulation
     *                        catalog loaded at startup; blank disables seeding
     */
    public record Regulations(String catalogLocation) {}
}
