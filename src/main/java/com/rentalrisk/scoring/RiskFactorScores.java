package com.rentalrisk.scoring;

public record RiskFactorScores(
    int productRisk,
    int renterRisk,
    int bookingRisk,
    int seasonalRisk
) {}
