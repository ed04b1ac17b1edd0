package com.rentalrisk.scoring;

import com.rentalrisk.config.RiskEngineProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class ScoringConfiguration {

    /**
     * Scoring engine with the four standard sub-scorers:
     * 1. Product (profile risk band plus declared factors)
     * 2. Renter (verification and history adjustments)
     * 3. Booking (duration and value against category norms)
     * 4. Seasonal (calendar windows)
     */
    @Bean
    public RiskScoringEngine riskScoringEngine(RiskEngineProperties properties) {
        RiskEngineProperties.Scoring scoring = properties.scoring();
        return new RiskScoringEngine(List.of(
            new ProductRiskScorer(scoring.product().factorIncrement()),
            new RenterRiskScorer(scoring.renter()),
            new BookingRiskScorer(scoring.booking().neutralScore()),
            new SeasonalRiskScorer()
        ), scoring.weights(), scoring.levelThresholds());
    }

    @Bean
    public RecommendationPolicy recommendationPolicy(RiskEngineProperties properties) {
        return new RecommendationPolicy(properties.scoring().recommendations());
    }
}
