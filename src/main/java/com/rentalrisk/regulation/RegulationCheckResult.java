package com.rentalrisk.regulation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Full regulation report for one candidate transaction. Compliance is
 * derived from the checks, never stored separately.
 */
public record RegulationCheckResult(
    String categoryId,
    String countryId,
    boolean regulationExists,
    Map<RegulationCheckType, SubCheck> checks,
    List<String> violations,
    List<String> warnings,
    List<String> recommendations
) {

    public RegulationCheckResult {
        checks = Collections.unmodifiableMap(checks.isEmpty()
            ? new EnumMap<>(RegulationCheckType.class)
            : new EnumMap<>(checks));
        violations = List.copyOf(violations);
        warnings = List.copyOf(warnings);
        recommendations = List.copyOf(recommendations);
    }

    /** True iff every applicable sub-check passed. */
    public boolean isCompliant() {
        return checks.values().stream()
            .filter(SubCheck::applicable)
            .allMatch(SubCheck::passed);
    }

    public SubCheck check(RegulationCheckType type) {
        return checks.get(type);
    }

    public long applicableCount() {
        return checks.values().stream().filter(SubCheck::applicable).count();
    }

    public long passedCount() {
        return checks.values().stream().filter(c -> c.applicable() && c.passed()).count();
    }

    static RegulationCheckResult noRegulation(String categoryId, String countryId) {
        Map<RegulationCheckType, SubCheck> checks = new EnumMap<>(RegulationCheckType.class);
        for (RegulationCheckType type : RegulationCheckType.values()) {
            checks.put(type, SubCheck.notApplicable(type));
        }
        return new RegulationCheckResult(categoryId, countryId, false, checks, List.of(),
            List.of("No regulation on file for category " + categoryId + " in country " + countryId),
            List.of());
    }
}
