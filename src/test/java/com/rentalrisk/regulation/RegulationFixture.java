package com.rentalrisk.regulation;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Fluent test builder; starts from a regulation that imposes nothing.
 */
class RegulationFixture {

    private final String categoryId;
    private final String countryId;
    private Boolean allowed = true;
    private boolean requiresLicense;
    private String licenseType;
    private Integer minAge;
    private Integer maxRentalDays;
    private String specialRequirements;
    private boolean mandatoryInsurance;
    private BigDecimal minCoverage;
    private boolean requiresBackgroundCheck;
    private String prohibitedActivities;
    private Map<String, SeasonalRestriction> seasonal = Map.of();
    private List<String> documentation = List.of();
    private RegulationComplianceLevel level = RegulationComplianceLevel.LOW;

    RegulationFixture(String categoryId, String countryId) {
        this.categoryId = categoryId;
        this.countryId = countryId;
    }

    static RegulationFixture regulation(String categoryId, String countryId) {
        return new RegulationFixture(categoryId, countryId);
    }

    RegulationFixture notAllowed() {
        this.allowed = false;
        return this;
    }

    RegulationFixture license(String type) {
        this.requiresLicense = true;
        this.licenseType = type;
        return this;
    }

    RegulationFixture minAge(int age) {
        this.minAge = age;
        return this;
    }

    RegulationFixture maxRentalDays(int days) {
        this.maxRentalDays = days;
        return this;
    }

    RegulationFixture insurance(String minCoverage) {
        this.mandatoryInsurance = true;
        this.minCoverage = minCoverage == null ? null : new BigDecimal(minCoverage);
        return this;
    }

    RegulationFixture backgroundCheck() {
        this.requiresBackgroundCheck = true;
        return this;
    }

    RegulationFixture documentation(String... documents) {
        this.documentation = List.of(documents);
        return this;
    }

    RegulationFixture seasonal(String season, SeasonalRestriction restriction) {
        this.seasonal = Map.of(season, restriction);
        return this;
    }

    RegulationFixture level(RegulationComplianceLevel level) {
        this.level = level;
        return this;
    }

    RegulationFixture notes(String specialRequirements, String prohibitedActivities) {
        this.specialRequirements = specialRequirements;
        this.prohibitedActivities = prohibitedActivities;
        return this;
    }

    CategoryRegulation build() {
        return new CategoryRegulation("reg-" + categoryId + "-" + countryId, categoryId, countryId, allowed,
            requiresLicense, licenseType, minAge, maxRentalDays, specialRequirements, mandatoryInsurance,
            minCoverage, null, requiresBackgroundCheck, prohibitedActivities, seasonal, documentation, level);
    }
}
