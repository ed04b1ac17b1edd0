package com.rentalrisk.profile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum EnforcementLevel {
    LENIENT("lenient"),
    MODERATE("moderate"),
    STRICT("strict"),
    VERY_STRICT("very_strict");

    private final String value;

    EnforcementLevel(String value) {
        this.value = value;
    }

    public boolean isAtLeast(EnforcementLevel other) {
        return ordinal() >= other.ordinal();
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static EnforcementLevel fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown enforcement level: " + raw));
    }
}
