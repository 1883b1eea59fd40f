package com.quantsignals.backtester.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * An open long position. Immutable from the moment it is opened.
 */
@Value
@Builder
public class Position {

    String symbol;
    long shares;
    BigDecimal entryPrice;
    LocalDate entryDate;
    /** Total cash debited on entry, commission included. */
    BigDecimal costBasis;
    BigDecimal entryCommission;

    public BigDecimal marketValue(BigDecimal price) {
        return price.multiply(BigDecimal.valueOf(shares));
    }
}
