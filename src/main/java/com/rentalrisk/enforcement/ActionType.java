package com.rentalrisk.enforcement;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ActionType {
    BLOCK_BOOKING("block_booking"),
    REQUIRE_INSURANCE("require_insurance"),
    REQUIRE_INSPECTION("require_inspection"),
    SEND_NOTIFICATION("send_notification"),
    ESCALATE("escalate");

    private final String value;

    ActionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ActionType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown enforcement action type: " + raw));
    }
}
