package com.rentalrisk.regulation;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Transaction attributes checked against a regulation. Every field is
 * optional; what a rule cannot see it reports as a warning. Malformed values
 * are left for the evaluator to reject.
 */
public record RegulationCandidate(
    Integer userAge,
    Integer rentalDurationDays,
    Boolean hasLicense,
    String licenseType,
    Boolean hasInsurance,
    BigDecimal coverageAmount,
    BackgroundCheckStatus backgroundCheckStatus,
    String season,
    List<String> documentationProvided
) {

    public RegulationCandidate {
        documentationProvided = documentationProvided == null
            ? null
            : Collections.unmodifiableList(new ArrayList<>(documentationProvided));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Integer userAge;
        private Integer rentalDurationDays;
        private Boolean hasLicense;
        private String licenseType;
        private Boolean hasInsurance;
        private BigDecimal coverageAmount;
        private BackgroundCheckStatus backgroundCheckStatus;
        private String season;
        private List<String> documentationProvided;

        private Builder() {
        }

        public Builder userAge(Integer userAge) {
            this.userAge = userAge;
            return this;
        }

        public Builder rentalDurationDays(Integer rentalDurationDays) {
            this.rentalDurationDays = rentalDurationDays;
            return this;
        }

        public Builder license(Boolean hasLicense, String licenseType) {
            this.hasLicense = hasLicense;
            this.licenseType = licenseType;
            return this;
        }

        public Builder insurance(Boolean hasInsurance, BigDecimal coverageAmount) {
            this.hasInsurance = hasInsurance;
            this.coverageAmount = coverageAmount;
            return this;
        }

        public Builder backgroundCheckStatus(BackgroundCheckStatus backgroundCheckStatus) {
            this.backgroundCheckStatus = backgroundCheckStatus;
            return this;
        }

        public Builder season(String season) {
            this.season = season;
            return this;
        }

        public Builder documentationProvided(List<String> documentationProvided) {
            this.documentationProvided = documentationProvided;
            return this;
        }

        public RegulationCandidate build() {
            return new RegulationCandidate(userAge, rentalDurationDays, hasLicense, licenseType,
                hasInsurance, coverageAmount, backgroundCheckStatus, season, documentationProvided);
        }
    }
}
