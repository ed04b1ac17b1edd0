package com.rentalrisk.violation;

import com.rentalrisk.config.RiskEngineProperties;
import com.rentalrisk.enforcement.Severity;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Penalty for a violation the caller did not price explicitly.
 */
@Component
public class PenaltyPolicy {

    private final RiskEngineProperties.Penalties penalties;

    public PenaltyPolicy(RiskEngineProperties properties) {
        this.penalties = properties.penalties();
    }

    public BigDecimal assess(Severity severity, long earlierViolationsOfRenter) {
        if (severity == Severity.CRITICAL) {
            return penalties.criticalViolation();
        }
        if (earlierViolationsOfRenter > 0) {
            return penalties.repeatViolation();
        }
        return penalties.firstViolation();
    }
}
