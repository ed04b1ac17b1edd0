package com.rentalrisk.regulation;

import com.rentalrisk.error.DependencyException;
import com.rentalrisk.error.ValidationException;
import com.rentalrisk.error.ValidationException.FieldError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates a category-country regulation against a candidate transaction.
 * Every rule runs, even after a failure, so the caller always gets the
 * complete report.
 */
public class RegulationComplianceEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RegulationComplianceEvaluator.class);

    private final RegulationStore store;
    private final List<RegulationRule> rules;

    public RegulationComplianceEvaluator(RegulationStore store, List<RegulationRule> rules) {
        this.store = store;
        this.rules = List.copyOf(rules);
    }

    public RegulationCheckResult checkCompliance(String categoryId, String countryId, RegulationCandidate candidate) {
        validate(categoryId, countryId, candidate);

        Optional<CategoryRegulation> found;
        try {
            found = store.find(categoryId, countryId);
        } catch (RuntimeException ex) {
            throw new DependencyException("regulation-store", ex);
        }
        if (found.isEmpty()) {
            log.debug("No regulation for category={} country={}", categoryId, countryId);
            return RegulationCheckResult.noRegulation(categoryId, countryId);
        }
        CategoryRegulation regulation = found.get();

        Map<RegulationCheckType, SubCheck> checks = new EnumMap<>(RegulationCheckType.class);
        List<String> violations = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        for (RegulationCheckType type : RegulationCheckType.values()) {
            checks.put(type, SubCheck.notApplicable(type));
        }
        for (RegulationRule rule : rules) {
            RegulationRule.Outcome outcome = rule.evaluate(regulation, candidate);
            SubCheck check = outcome.check();
            checks.put(check.type(), check);
            if (check.failed()) {
                violations.add(check.message());
            }
            warnings.addAll(outcome.warnings());
            recommendations.addAll(outcome.recommendations());
        }
        recommendations.addAll(generalRecommendations(regulation));

        RegulationCheckResult result = new RegulationCheckResult(
            categoryId, countryId, true, checks, violations, warnings, recommendations);
        log.debug("Regulation check category={} country={} compliant={} violations={}",
            categoryId, countryId, result.isCompliant(), violations.size());
        return result;
    }

    private List<String> generalRecommendations(CategoryRegulation regulation) {
        List<String> recommendations = new ArrayList<>();
        if (regulation.complianceLevel().isHighOrAbove()) {
            recommendations.add("This category has high compliance requirements. Ensure all documentation is complete.");
        }
        if (regulation.specialRequirements() != null) {
            recommendations.add("Special requirements: " + regulation.specialRequirements());
        }
        if (regulation.prohibitedActivities() != null) {
            recommendations.add("Prohibited activities: " + regulation.prohibitedActivities());
        }
        if (regulation.maxRentalDays() != null) {
            recommendations.add("Maximum rental period is " + regulation.maxRentalDays() + " days");
        }
        return recommendations;
    }

    private void validate(String categoryId, String countryId, RegulationCandidate candidate) {
        List<FieldError> errors = new ArrayList<>();
        if (categoryId == null || categoryId.isBlank()) {
            errors.add(new FieldError("category_id", "Category ID is required"));
        }
        if (countryId == null || countryId.isBlank()) {
            errors.add(new FieldError("country_id", "Country ID is required"));
        }
        if (candidate == null) {
            errors.add(new FieldError("candidate", "Candidate transaction is required"));
        } else {
            if (candidate.userAge() != null && (candidate.userAge() < 0 || candidate.userAge() > 120)) {
                errors.add(new FieldError("user_age", "User age must be between 0 and 120"));
            }
            if (candidate.coverageAmount() != null && candidate.coverageAmount().compareTo(BigDecimal.ZERO) < 0) {
                errors.add(new FieldError("coverage_amount", "Coverage amount must be 0 or greater"));
            }
            if (candidate.rentalDurationDays() != null && candidate.rentalDurationDays() < 0) {
                errors.add(new FieldError("rental_duration_days", "Rental duration must be 0 or greater"));
            }
            List<String> documents = candidate.documentationProvided();
            if (documents != null && documents.stream().anyMatch(d -> d == null || d.isBlank())) {
                errors.add(new FieldError("documentation_provided", "Documentation entries must not be blank"));
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }
}
