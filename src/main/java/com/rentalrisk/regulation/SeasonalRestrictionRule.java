package com.rentalrisk.regulation;

import java.util.Map;

import static com.rentalrisk.regulation.RegulationRules.context;

/**
 * Any restriction defined for the candidate's season fails the check;
 * season names match case-insensitively.
 */
public class SeasonalRestrictionRule implements RegulationRule {

    @Override
    public RegulationCheckType type() {
        return RegulationCheckType.SEASONAL_RESTRICTIONS;
    }

    @Override
    public Outcome evaluate(CategoryRegulation regulation, RegulationCandidate candidate) {
        Map<String, SeasonalRestriction> restrictions = regulation.seasonalRestrictions();
        if (restrictions.isEmpty()) {
            return Outcome.of(SubCheck.notApplicable(type()));
        }
        String season = candidate.season();
        if (season == null) {
            return Outcome.withWarning(SubCheck.pass(type(), context("restricted_seasons", restrictions.keySet())),
                "Season not provided; seasonal restrictions could not be verified");
        }
        for (Map.Entry<String, SeasonalRestriction> entry : restrictions.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(season)) {
                String detail = entry.getValue().describe();
                return Outcome.of(SubCheck.fail(type(),
                    context("season", season, "restriction", detail),
                    "Seasonal restrictions apply for " + season + ": " + detail));
            }
        }
        return Outcome.of(SubCheck.pass(type(), context("season", season)));
    }
}
