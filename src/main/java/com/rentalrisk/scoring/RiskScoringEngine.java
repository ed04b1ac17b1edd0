package com.rentalrisk.scoring;

import com.rentalrisk.config.RiskEngineProperties.LevelThresholds;
import com.rentalrisk.config.RiskEngineProperties.Weights;
import com.rentalrisk.profile.RiskLevel;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Combines the four weighted sub-scores into an overall 0-100 score and a
 * discrete level. Weights and level thresholds are injected so the same
 * engine runs under test policies.
 */
public class RiskScoringEngine {

    private final Map<RiskFactor, RiskFactorScorer> scorers = new EnumMap<>(RiskFactor.class);
    private final Weights weights;
    private final LevelThresholds thresholds;

    public RiskScoringEngine(List<RiskFactorScorer> scorers, Weights weights, LevelThresholds thresholds) {
        for (RiskFactorScorer scorer : scorers) {
            if (this.scorers.put(scorer.factor(), scorer) != null) {
                throw new IllegalArgumentException("Duplicate scorer for factor " + scorer.factor());
            }
        }
        for (RiskFactor factor : RiskFactor.values()) {
            if (!this.scorers.containsKey(factor)) {
                throw new IllegalArgumentException("No scorer registered for factor " + factor);
            }
        }
        this.weights = weights;
        this.thresholds = thresholds;
    }

    public RiskScore score(ScoringContext context) {
        RiskFactorScores factors = new RiskFactorScores(
            scorers.get(RiskFactor.PRODUCT).score(context),
            scorers.get(RiskFactor.RENTER).score(context),
            scorers.get(RiskFactor.BOOKING).score(context),
            scorers.get(RiskFactor.SEASONAL).score(context)
        );
        int overall = combine(factors, weights);
        return new RiskScore(factors, overall, levelOf(overall));
    }

    /**
     * Weighted average rounded half-up to an integer and clamped to [0, 100].
     */
    public static int combine(RiskFactorScores factors, Weights weights) {
        double weighted = factors.productRisk() * weights.product()
            + factors.renterRisk() * weights.renter()
            + factors.bookingRisk() * weights.booking()
            + factors.seasonalRisk() * weights.seasonal();
        return RiskFactorScorer.clamp(Math.round(weighted));
    }

    public RiskLevel levelOf(int overall) {
        if (overall >= thresholds.critical()) {
            return RiskLevel.CRITICAL;
        }
        if (overall >= thresholds.high()) {
            return RiskLevel.HIGH;
        }
        if (overall >= thresholds.medium()) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }
}
