package com.rentalrisk.regulation;

import static com.rentalrisk.regulation.RegulationRules.context;

/**
 * A license of the wrong type fails only when the renter states a type;
 * an unstated type is reported as a warning.
 */
public class LicenseRule implements RegulationRule {

    @Override
    public RegulationCheckType type() {
        return RegulationCheckType.LICENSE_REQUIREMENT;
    }

    @Override
    public Outcome evaluate(CategoryRegulation regulation, RegulationCandidate candidate) {
        if (!regulation.requiresLicense()) {
            return Outcome.of(SubCheck.notApplicable(type()));
        }
        String requiredType = regulation.licenseType();
        String providedType = candidate.licenseType();
        var context = context(
            "required_type", requiredType,
            "has_license", candidate.hasLicense(),
            "provided_type", providedType);

        if (!Boolean.TRUE.equals(candidate.hasLicense())) {
            String advice = requiredType != null ? "Obtain a " + requiredType + " license" : "Obtain a valid license";
            return Outcome.withRecommendation(SubCheck.fail(type(), context, "Valid license is required"), advice);
        }
        if (requiredType == null) {
            return Outcome.of(SubCheck.pass(type(), context));
        }
        if (providedType == null) {
            return Outcome.withWarning(SubCheck.pass(type(), context),
                "License type not provided; required type " + requiredType + " could not be verified");
        }
        if (!providedType.equalsIgnoreCase(requiredType)) {
            return Outcome.withRecommendation(
                SubCheck.fail(type(), context, "License type must be: " + requiredType),
                "Obtain a " + requiredType + " license");
        }
        return Outcome.of(SubCheck.pass(type(), context));
    }
}
