package com.rentalrisk.regulation;

import java.util.List;

/**
 * One regulation sub-check. Rules are pure: no lookups, no side effects,
 * and each rule judges its own requirement only.
 */
public interface RegulationRule {

    RegulationCheckType type();

    Outcome evaluate(CategoryRegulation regulation, RegulationCandidate candidate);

    /**
     * A sub-check plus the soft findings it produced along the way.
     */
    record Outcome(
        SubCheck check,
        List<String> warnings,
        List<String> recommendations
    ) {

        public Outcome {
            warnings = List.copyOf(warnings);
            recommendations = List.copyOf(recommendations);
        }

        public static Outcome of(SubCheck check) {
            return new Outcome(check, List.of(), List.of());
        }

        public static Outcome withWarning(SubCheck check, String warning) {
            return new Outcome(check, List.of(warning), List.of());
        }

        public static Outcome withRecommendation(SubCheck check, String recommendation) {
            return new Outcome(check, List.of(), List.of(recommendation));
        }
    }
}
