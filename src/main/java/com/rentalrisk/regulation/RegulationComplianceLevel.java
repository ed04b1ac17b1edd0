package com.rentalrisk.regulation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum RegulationComplianceLevel {
    LOW("LOW"),
    MEDIUM("MEDIUM"),
    HIGH("HIGH"),
    CRITICAL("CRITICAL");

    private final String value;

    RegulationComplianceLevel(String value) {
        this.value = value;
    }

    public boolean isHighOrAbove() {
        return this == HIGH || this == CRITICAL;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static RegulationComplianceLevel fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown compliance level: " + raw));
    }
}
