package com.rentalrisk.facts;

import java.time.MonthDay;

/**
 * A recurring calendar window carrying a seasonal risk score. Windows may
 * wrap the year end (Dec 01 .. Feb 28).
 */
public record SeasonalRiskWindow(MonthDay from, MonthDay to, int score) {

    public boolean contains(MonthDay day) {
        if (!from.isAfter(to)) {
            return !day.isBefore(from) && !day.isAfter(to);
        }
        return !day.isBefore(from) || !day.isAfter(to);
    }
}
