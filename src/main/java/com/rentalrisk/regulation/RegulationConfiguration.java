package com.rentalrisk.regulation;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RegulationConfiguration {

    @Bean
    public RegulationComplianceEvaluator regulationComplianceEvaluator(RegulationStore store) {
        return new RegulationComplianceEvaluator(store, RegulationRules.standard());
    }
}
