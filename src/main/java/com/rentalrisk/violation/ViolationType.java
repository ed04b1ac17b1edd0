package com.rentalrisk.violation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ViolationType {
    MISSING_INSURANCE("missing_insurance"),
    MISSING_INSPECTION("missing_inspection"),
    INADEQUATE_COVERAGE("inadequate_coverage"),
    EXPIRED_COMPLIANCE("expired_compliance");

    private final String value;

    ViolationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ViolationType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown violation type: " + raw));
    }
}
