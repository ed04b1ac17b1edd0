package com.rentalrisk.violation;

import com.rentalrisk.enforcement.Severity;

import java.math.BigDecimal;

/**
 * Input to {@link ViolationLedger#record}.
 *
 * @param penaltyAmount explicit penalty; null lets the penalty policy assess it
 */
public record ViolationDraft(
    String bookingId,
    String productId,
    String renterId,
    ViolationType violationType,
    Severity severity,
    String description,
    BigDecimal penaltyAmount
) {}
