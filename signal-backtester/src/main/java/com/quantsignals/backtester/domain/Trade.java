package com.quantsignals.backtester.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A closed round trip. {@code profit} always equals
 * {@code (exitPrice - entryPrice) * shares - commission}.
 */
@Value
@Builder
public class Trade {

    String symbol;
    long shares;
    BigDecimal entryPrice;
    LocalDate entryDate;
    BigDecimal exitPrice;
    LocalDate exitDate;
    BigDecimal costBasis;
    BigDecimal proceeds;
    /** Entry plus exit commission. */
    BigDecimal commission;
    BigDecimal profit;
    BigDecimal returnPct;
    boolean forcedExit;

    public boolean isProfitable() {
        return profit.signum() > 0;
    }
}
