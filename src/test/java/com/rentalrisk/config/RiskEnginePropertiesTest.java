package com.rentalrisk.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.test.context.ConfigDataApplicationContextInitializer;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.math.BigDecimal;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RiskEnginePropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withInitializer(new ConfigDataApplicationContextInitializer())
        .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
        .withUserConfiguration(EngineConfiguration.class);

    @Test
    void bundledConfigurationBinds() {
        runner.run(context -> {
            assertThat(context).hasNotFailed();
            RiskEngineProperties properties = context.getBean(RiskEngineProperties.class);
            assertThat(properties.scoring().weights().product()).isEqualTo(0.40);
            assertThat(properties.scoring().levelThresholds().critical()).isEqualTo(85);
            assertThat(properties.scoring().assessmentValidity()).isEqualTo(Duration.ofHours(24));
            assertThat(properties.compliance().recheckInterval()).isEqualTo(Duration.ofMinutes(15));
            assertThat(properties.penalties().criticalViolation()).isEqualByComparingTo(new BigDecimal("500"));
            assertThat(properties.regulations().catalogLocation()).isEqualTo("classpath:regulations/catalog.json");
        });
    }

    @Test
    void weightsMustSumToOne() {
        runner.withPropertyValues("risk-engine.scoring.weights.product=0.50")
            .run(context -> assertThat(context.getStartupFailure())
                .isNotNull()
                .hasStackTraceContaining("scoring weights must sum to 1.0"));
    }

    @Test
    void thresholdsMustAscend() {
        runner.withPropertyValues("risk-engine.scoring.level-thresholds.high=30")
            .run(context -> assertThat(context.getStartupFailure())
                .isNotNull()
                .hasStackTraceContaining("level thresholds must be strictly ascending"));
    }

    @Test
    void misspeltKeyStopsStartup() {
        runner.withPropertyValues("risk-engine.scoring.weights.sesonal=0.15")
            .run(context -> assertThat(context.getStartupFailure())
                .isNotNull()
                .hasStackTraceContaining("risk-engine.scoring.weights.sesonal"));
    }
}
