package com.rentalrisk.scoring;

import com.rentalrisk.profile.RiskLevel;

public record RiskScore(RiskFactorScores factors, int overall, RiskLevel level) {}
