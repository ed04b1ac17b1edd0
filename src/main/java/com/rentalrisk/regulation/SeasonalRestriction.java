package com.rentalrisk.regulation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Restriction a regulation imposes during one named season.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SeasonalRestriction(
    @JsonProperty("max_days") Integer maxDays,
    @JsonProperty("max_consecutive_days") Integer maxConsecutiveDays,
    @JsonProperty("special_rate") Boolean specialRate,
    @JsonProperty("advance_booking_required") Boolean advanceBookingRequired,
    @JsonProperty("additional_requirements") List<String> additionalRequirements,
    @JsonProperty("additional_safety") Boolean additionalSafety,
    @JsonProperty("restricted_equipment") List<String> restrictedEquipment,
    @JsonProperty("extended_hours") Boolean extendedHours
) {

    public SeasonalRestriction {
        additionalRequirements = additionalRequirements == null ? List.of() : List.copyOf(additionalRequirements);
        restrictedEquipment = restrictedEquipment == null ? List.of() : List.copyOf(restrictedEquipment);
    }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        if (maxDays != null) {
            sb.append("max ").append(maxDays).append(" days");
        }
        if (maxConsecutiveDays != null) {
            append(sb, "max " + maxConsecutiveDays + " consecutive days");
        }
        if (Boolean.TRUE.equals(advanceBookingRequired)) {
            append(sb, "advance booking required");
        }
        if (Boolean.TRUE.equals(additionalSafety)) {
            append(sb, "additional safety measures");
        }
        if (!additionalRequirements.isEmpty()) {
            append(sb, "requires " + String.join(", ", additionalRequirements));
        }
        if (!restrictedEquipment.isEmpty()) {
            append(sb, "restricted equipment: " + String.join(", ", restrictedEquipment));
        }
        return sb.length() == 0 ? "restricted" : sb.toString();
    }

    private static void append(StringBuilder sb, String part) {
        if (sb.length() > 0) {
            sb.append("; ");
        }
        sb.append(part);
    }
}
