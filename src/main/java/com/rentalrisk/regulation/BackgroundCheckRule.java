package com.rentalrisk.regulation;

import static com.rentalrisk.regulation.RegulationRules.context;

public class BackgroundCheckRule implements RegulationRule {

    @Override
    public RegulationCheckType type() {
        return RegulationCheckType.BACKGROUND_CHECK;
    }

    @Override
    public Outcome evaluate(CategoryRegulation regulation, RegulationCandidate candidate) {
        if (!regulation.requiresBackgroundCheck()) {
            return Outcome.of(SubCheck.notApplicable(type()));
        }
        BackgroundCheckStatus status = candidate.backgroundCheckStatus();
        var context = context("status", status == null ? null : status.getValue());
        if (status == BackgroundCheckStatus.APPROVED) {
            return Outcome.of(SubCheck.pass(type(), context));
        }
        return Outcome.of(SubCheck.fail(type(), context, "Background check approval required"));
    }
}
