package com.rentalrisk.regulation;

import static com.rentalrisk.regulation.RegulationRules.context;

public class RentalDurationRule implements RegulationRule {

    @Override
    public RegulationCheckType type() {
        return RegulationCheckType.RENTAL_DURATION;
    }

    @Override
    public Outcome evaluate(CategoryRegulation regulation, RegulationCandidate candidate) {
        Integer max = regulation.maxRentalDays();
        if (max == null) {
            return Outcome.of(SubCheck.notApplicable(type()));
        }
        Integer days = candidate.rentalDurationDays();
        if (days == null) {
            return Outcome.withWarning(SubCheck.pass(type(), context("max_days", max, "provided", null)),
                "Rental duration not provided; maximum of " + max + " days could not be verified");
        }
        if (days > max) {
            return Outcome.withRecommendation(
                SubCheck.fail(type(), context("max_days", max, "provided", days),
                    "Rental duration of " + days + " days exceeds the maximum of " + max + " days"),
                "Shorten the rental to at most " + max + " days");
        }
        return Outcome.of(SubCheck.pass(type(), context("max_days", max, "provided", days)));
    }
}
