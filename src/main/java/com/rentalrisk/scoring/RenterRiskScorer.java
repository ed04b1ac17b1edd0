package com.rentalrisk.scoring;

import com.rentalrisk.config.RiskEngineProperties.RenterScoring;
import com.rentalrisk.facts.RenterFacts;

import java.time.Duration;

/**
 * Adjusts a neutral score by verification and history signals. A renter with
 * no history and no verification keeps the neutral score.
 */
public class RenterRiskScorer implements RiskFactorScorer {

    private final RenterScoring config;

    public RenterRiskScorer(RenterScoring config) {
        this.config = config;
    }

    @Override
    public RiskFactor factor() {
        return RiskFactor.RENTER;
    }

    @Override
    public int score(ScoringContext context) {
        RenterFacts renter = context.renter();
        long score = config.neutralScore();

        if (renter.verified()) {
            score -= config.verifiedCredit();
        }
        if (renter.kycVerified()) {
            score -= config.kycCredit();
        }
        if (renter.accountCreatedAt() != null) {
            long ageDays = Duration.between(renter.accountCreatedAt(), context.now()).toDays();
            if (ageDays >= config.establishedAccountDays()) {
                score -= config.establishedAccountCredit();
            } else if (ageDays < config.newAccountDays()) {
                score += config.newAccountPenalty();
            }
        }
        if (renter.completedBookings() != null && renter.completedBookings() >= config.experiencedRenterBookings()) {
            score -= config.experiencedRenterCredit();
        }
        if (renter.priorViolations() != null) {
            score += (long) renter.priorViolations() * config.priorViolationPenalty();
        }
        return RiskFactorScorer.clamp(score);
    }
}
