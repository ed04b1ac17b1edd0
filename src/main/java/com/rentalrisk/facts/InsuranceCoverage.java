package com.rentalrisk.facts;

import java.math.BigDecimal;

public record InsuranceCoverage(
    String policyId,
    boolean active,
    BigDecimal coverageAmount
) {}
