package com.rentalrisk.regulation;

import java.util.List;

import static com.rentalrisk.regulation.RegulationRules.context;

public class DocumentationRule implements RegulationRule {

    @Override
    public RegulationCheckType type() {
        return RegulationCheckType.DOCUMENTATION;
    }

    @Override
    public Outcome evaluate(CategoryRegulation regulation, RegulationCandidate candidate) {
        List<String> required = regulation.documentationRequired();
        if (required.isEmpty()) {
            return Outcome.of(SubCheck.notApplicable(type()));
        }
        List<String> provided = candidate.documentationProvided() == null ? List.of() : candidate.documentationProvided();
        List<String> missing = required.stream()
            .filter(doc -> !provided.contains(doc))
            .toList();
        var context = context("required", required, "provided", provided, "missing", missing);

        if (missing.isEmpty()) {
            return Outcome.of(SubCheck.pass(type(), context));
        }
        return Outcome.withRecommendation(
            SubCheck.fail(type(), context, "Missing required documents: " + String.join(", ", missing)),
            "Provide " + String.join(", ", missing));
    }
}
