package com.rentalrisk.scoring;

/**
 * Computes one risk sub-score in [0, 100]. Scorers are deterministic
 * functions of the context: no lookups, no clock reads.
 */
public interface RiskFactorScorer {

    RiskFactor factor();

    int score(ScoringContext context);

    static int clamp(long raw) {
        return (int) Math.max(0, Math.min(100, raw));
    }
}
