package com.rentalrisk.regulation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The fixed set of sub-checks every regulation report carries.
 */
public enum RegulationCheckType {
    IS_ALLOWED("is_allowed"),
    AGE_REQUIREMENT("age_requirement"),
    LICENSE_REQUIREMENT("license_requirement"),
    RENTAL_DURATION("rental_duration"),
    INSURANCE_REQUIREMENT("insurance_requirement"),
    BACKGROUND_CHECK("background_check"),
    DOCUMENTATION("documentation"),
    SEASONAL_RESTRICTIONS("seasonal_restrictions");

    private final String value;

    RegulationCheckType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
