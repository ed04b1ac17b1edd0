package com.rentalrisk.scoring;

import com.rentalrisk.facts.BookingFacts;
import com.rentalrisk.facts.CategoryNorms;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Compares booking length and value with the category's typical booking.
 * A booking exactly at the norm scores 50; each dimension contributes half.
 */
public class BookingRiskScorer implements RiskFactorScorer {

    private static final double POINTS_PER_NORM = 25.0;

    private final int neutralScore;

    public BookingRiskScorer(int neutralScore) {
        this.neutralScore = neutralScore;
    }

    @Override
    public RiskFactor factor() {
        return RiskFactor.BOOKING;
    }

    @Override
    public int score(ScoringContext context) {
        BookingFacts booking = context.booking();
        CategoryNorms norms = context.norms();
        if (booking == null || norms == null) {
            return neutralScore;
        }

        double durationRatio = 1.0;
        Integer days = booking.durationDays();
        if (days != null && norms.typicalDurationDays() > 0) {
            durationRatio = days / (double) norms.typicalDurationDays();
        }

        double valueRatio = 1.0;
        BigDecimal typicalValue = norms.typicalBookingValue();
        if (booking.totalValue() != null && typicalValue != null && typicalValue.signum() > 0) {
            valueRatio = booking.totalValue().divide(typicalValue, MathContext.DECIMAL64).doubleValue();
        }

        return RiskFactorScorer.clamp(Math.round(POINTS_PER_NORM * durationRatio + POINTS_PER_NORM * valueRatio));
    }
}
