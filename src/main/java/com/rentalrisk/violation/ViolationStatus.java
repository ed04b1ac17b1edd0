package com.rentalrisk.violation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ViolationStatus {
    ACTIVE("active"),
    RESOLVED("resolved"),
    ESCALATED("escalated");

    private final String value;

    ViolationStatus(String value) {
        this.value = value;
    }

    /** Active and escalated violations both still await resolution. */
    public boolean isOpen() {
        return this != RESOLVED;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ViolationStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown violation status: " + raw));
    }
}
