package com.rentalrisk.profile;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Requirements a booking of the product must satisfy before it is compliant.
 *
 * @param minCoverage             minimum insured amount; zero when any active policy suffices
 * @param inspectionTypes         inspection types that must all be completed; empty means any
 * @param complianceDeadlineHours time given to satisfy a {@code require_*} action
 */
public record MandatoryRequirements(
    boolean insuranceRequired,
    boolean inspectionRequired,
    BigDecimal minCoverage,
    List<String> inspectionTypes,
    int complianceDeadlineHours
) {

    public static final int DEFAULT_DEADLINE_HOURS = 24;

    public MandatoryRequirements {
        minCoverage = minCoverage == null ? BigDecimal.ZERO : minCoverage;
        // null entries are kept so the validator can report them
        inspectionTypes = inspectionTypes == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(inspectionTypes));
    }

    public static MandatoryRequirements none() {
        return new MandatoryRequirements(false, false, BigDecimal.ZERO, List.of(), DEFAULT_DEADLINE_HOURS);
    }

    public boolean hasCoverageFloor() {
        return minCoverage.signum() > 0;
    }
}
