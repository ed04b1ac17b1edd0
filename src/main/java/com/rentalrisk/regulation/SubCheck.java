package com.rentalrisk.regulation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one regulation sub-check.
 *
 * @param applicable false when the regulation imposes no such requirement;
 *                   an inapplicable check is always passed
 * @param context    the required and provided values the check compared
 * @param message    failure or informational text, null on a plain pass
 */
public record SubCheck(
    RegulationCheckType type,
    boolean applicable,
    boolean passed,
    Map<String, Object> context,
    String message
) {

    public SubCheck {
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        if (!applicable && !passed) {
            throw new IllegalArgumentException("inapplicable check " + type + " cannot fail");
        }
    }

    public static SubCheck notApplicable(RegulationCheckType type) {
        return new SubCheck(type, false, true, Map.of(), null);
    }

    public static SubCheck pass(RegulationCheckType type, Map<String, Object> context) {
        return new SubCheck(type, true, true, context, null);
    }

    public static SubCheck fail(RegulationCheckType type, Map<String, Object> context, String message) {
        return new SubCheck(type, true, false, context, message);
    }

    public boolean failed() {
        return applicable && !passed;
    }
}
