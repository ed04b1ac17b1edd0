package com.rentalrisk.regulation;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class RegulationRules {

    private RegulationRules() {
    }

    /**
     * The eight sub-checks of a regulation report, in report order.
     */
    public static List<RegulationRule> standard() {
        return List.of(
            new AllowanceRule(),
            new MinimumAgeRule(),
            new LicenseRule(),
            new RentalDurationRule(),
            new InsuranceRule(),
            new BackgroundCheckRule(),
            new DocumentationRule(),
            new SeasonalRestrictionRule()
        );
    }

    /** Ordered context map; values may be null. */
    static Map<String, Object> context(Object... keysAndValues) {
        Map<String, Object> context = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
            context.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return context;
    }

    static String amount(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
