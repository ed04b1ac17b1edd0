package com.rentalrisk.regulation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Legal rule set for renting one category in one country.
 *
 * Nullable numeric limits mean "not regulated". {@code is_allowed} defaults
 * to true and {@code compliance_level} to MEDIUM when absent from the catalog.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CategoryRegulation(
    @JsonProperty("id") String id,
    @JsonProperty("category_id") String categoryId,
    @JsonProperty("country_id") String countryId,
    @JsonProperty("is_allowed") Boolean allowed,
    @JsonProperty("requires_license") boolean requiresLicense,
    @JsonProperty("license_type") String licenseType,
    @JsonProperty("min_age_requirement") Integer minAgeRequirement,
    @JsonProperty("max_rental_days") Integer maxRentalDays,
    @JsonProperty("special_requirements") String specialRequirements,
    @JsonProperty("mandatory_insurance") boolean mandatoryInsurance,
    @JsonProperty("min_coverage_amount") BigDecimal minCoverageAmount,
    @JsonProperty("max_liability_amount") BigDecimal maxLiabilityAmount,
    @JsonProperty("requires_background_check") boolean requiresBackgroundCheck,
    @JsonProperty("prohibited_activities") String prohibitedActivities,
    @JsonProperty("seasonal_restrictions") Map<String, SeasonalRestriction> seasonalRestrictions,
    @JsonProperty("documentation_required") List<String> documentationRequired,
    @JsonProperty("compliance_level") RegulationComplianceLevel complianceLevel
) {

    public CategoryRegulation {
        allowed = allowed == null ? Boolean.TRUE : allowed;
        seasonalRestrictions = seasonalRestrictions == null ? Map.of() : Map.copyOf(seasonalRestrictions);
        documentationRequired = documentationRequired == null ? List.of() : List.copyOf(documentationRequired);
        complianceLevel = complianceLevel == null ? RegulationComplianceLevel.MEDIUM : complianceLevel;
    }
}
