package com.rentalrisk.profile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum RiskLevel {
    LOW("low", 10, 25),
    MEDIUM("medium", 26, 50),
    HIGH("high", 51, 75),
    CRITICAL("critical", 76, 100);

    private final String value;
    private final int bandFloor;
    private final int bandCeiling;

    RiskLevel(String value, int bandFloor, int bandCeiling) {
        this.value = value;
        this.bandFloor = bandFloor;
        this.bandCeiling = bandCeiling;
    }

    /** Highest product-risk score a profile at this level can produce. */
    public int bandCeiling() {
        return bandCeiling;
    }

    public int bandMidpoint() {
        return (bandFloor + bandCeiling) / 2;
    }

    /**
     * Enforcement level applied when a profile is created without one.
     */
    public EnforcementLevel defaultEnforcementLevel() {
        return switch (this) {
            case LOW -> EnforcementLevel.LENIENT;
            case MEDIUM -> EnforcementLevel.MODERATE;
            case HIGH -> EnforcementLevel.STRICT;
            case CRITICAL -> EnforcementLevel.VERY_STRICT;
        };
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static RiskLevel fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown risk level: " + raw));
    }
}
