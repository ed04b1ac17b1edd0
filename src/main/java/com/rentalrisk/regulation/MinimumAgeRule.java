package com.rentalrisk.regulation;

import static com.rentalrisk.regulation.RegulationRules.context;

public class MinimumAgeRule implements RegulationRule {

    @Override
    public RegulationCheckType type() {
        return RegulationCheckType.AGE_REQUIREMENT;
    }

    @Override
    public Outcome evaluate(CategoryRegulation regulation, RegulationCandidate candidate) {
        Integer required = regulation.minAgeRequirement();
        if (required == null) {
            return Outcome.of(SubCheck.notApplicable(type()));
        }
        Integer age = candidate.userAge();
        if (age == null) {
            return Outcome.withWarning(SubCheck.pass(type(), context("required", required, "provided", null)),
                "User age not provided; minimum age of " + required + " could not be verified");
        }
        if (age < required) {
            return Outcome.of(SubCheck.fail(type(), context("required", required, "provided", age),
                "User must be at least " + required + " years old"));
        }
        return Outcome.of(SubCheck.pass(type(), context("required", required, "provided", age)));
    }
}
