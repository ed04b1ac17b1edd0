package com.rentalrisk.regulation;

import static com.rentalrisk.regulation.RegulationRules.context;

public class AllowanceRule implements RegulationRule {

    @Override
    public RegulationCheckType type() {
        return RegulationCheckType.IS_ALLOWED;
    }

    @Override
    public Outcome evaluate(CategoryRegulation regulation, RegulationCandidate candidate) {
        if (regulation.allowed()) {
            return Outcome.of(SubCheck.pass(type(), context("allowed", true)));
        }
        return Outcome.of(SubCheck.fail(type(), context("allowed", false),
            "Category is not allowed in this country"));
    }
}
