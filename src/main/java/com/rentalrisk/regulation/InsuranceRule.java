package com.rentalrisk.regulation;

import java.math.BigDecimal;

import static com.rentalrisk.regulation.RegulationRules.amount;
import static com.rentalrisk.regulation.RegulationRules.context;

public class InsuranceRule implements RegulationRule {

    @Override
    public RegulationCheckType type() {
        return RegulationCheckType.INSURANCE_REQUIREMENT;
    }

    @Override
    public Outcome evaluate(CategoryRegulation regulation, RegulationCandidate candidate) {
        if (!regulation.mandatoryInsurance()) {
            return Outcome.of(SubCheck.notApplicable(type()));
        }
        BigDecimal minimum = regulation.minCoverageAmount();
        BigDecimal coverage = candidate.coverageAmount();
        var context = context(
            "min_coverage", minimum,
            "has_insurance", candidate.hasInsurance(),
            "coverage_amount", coverage);

        if (!Boolean.TRUE.equals(candidate.hasInsurance())) {
            return Outcome.withRecommendation(SubCheck.fail(type(), context, "Insurance coverage is mandatory"),
                minimum != null && minimum.signum() > 0
                    ? "Purchase insurance with coverage of at least " + amount(minimum)
                    : "Purchase insurance coverage");
        }
        if (minimum != null && minimum.signum() > 0 && (coverage == null || coverage.compareTo(minimum) < 0)) {
            return Outcome.withRecommendation(
                SubCheck.fail(type(), context, "Insufficient insurance coverage. Minimum required: " + amount(minimum)),
                "Increase coverage to at least " + amount(minimum));
        }
        return Outcome.of(SubCheck.pass(type(), context));
    }
}
