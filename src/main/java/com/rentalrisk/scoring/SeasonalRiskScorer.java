package com.rentalrisk.scoring;

import com.rentalrisk.facts.SeasonalRiskWindow;

import java.time.MonthDay;

/**
 * Highest score among the category's calendar windows covering today;
 * zero when none applies.
 */
public class SeasonalRiskScorer implements RiskFactorScorer {

    @Override
    public RiskFactor factor() {
        return RiskFactor.SEASONAL;
    }

    @Override
    public int score(ScoringContext context) {
        MonthDay today = MonthDay.from(context.today());
        int max = 0;
        for (SeasonalRiskWindow window : context.seasonalCalendar()) {
            if (window.contains(today)) {
                max = Math.max(max, window.score());
            }
        }
        return RiskFactorScorer.clamp(max);
    }
}
