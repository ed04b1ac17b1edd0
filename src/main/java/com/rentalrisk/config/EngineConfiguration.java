package com.rentalrisk.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(RiskEngineProperties.class)
public class EngineConfiguration {

    /**
     * Single time source for assessments, deadlines and grace periods.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
