package com.rentalrisk.compliance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ComplianceStatus {
    COMPLIANT("compliant"),
    NON_COMPLIANT("non_compliant"),
    PENDING("pending"),
    GRACE_PERIOD("grace_period"),
    EXEMPT("exempt");

    private final String value;

    ComplianceStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ComplianceStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown compliance status: " + raw));
    }
}
