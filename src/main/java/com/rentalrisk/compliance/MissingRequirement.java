package com.rentalrisk.compliance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import com.rentalrisk.enforcement.ActionType;
import com.rentalrisk.violation.ViolationType;

import java.util.Arrays;
import java.util.Optional;

public enum MissingRequirement {
    MISSING_INSURANCE("missing_insurance"),
    INADEQUATE_COVERAGE("inadequate_coverage"),
    MISSING_INSPECTION("missing_inspection"),
    REGULATORY_NONCOMPLIANCE("regulatory_noncompliance");

    private final String value;

    MissingRequirement(String value) {
        this.value = value;
    }

    /**
     * Ledger entry type recorded when enforcement acts on this gap. Regulatory
     * failures have no ledger type of their own.
     */
    public Optional<ViolationType> violationType() {
        return switch (this) {
            case MISSING_INSURANCE -> Optional.of(ViolationType.MISSING_INSURANCE);
            case INADEQUATE_COVERAGE -> Optional.of(ViolationType.INADEQUATE_COVERAGE);
            case MISSING_INSPECTION -> Optional.of(ViolationType.MISSING_INSPECTION);
            case REGULATORY_NONCOMPLIANCE -> Optional.empty();
        };
    }

    /**
     * The {@code require_*} action that remedies this gap, if any.
     */
    public Optional<ActionType> remedy() {
        return switch (this) {
            case MISSING_INSURANCE, INADEQUATE_COVERAGE -> Optional.of(ActionType.REQUIRE_INSURANCE);
            case MISSING_INSPECTION -> Optional.of(ActionType.REQUIRE_INSPECTION);
            case REGULATORY_NONCOMPLIANCE -> Optional.empty();
        };
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static MissingRequirement fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown requirement: " + raw));
    }
}
