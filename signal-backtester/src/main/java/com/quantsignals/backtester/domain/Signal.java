package com.quantsignals.backtester.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * A trading decision for one symbol on one bar.
 */
@Value
@Builder
public class Signal {

    String symbol;
    SignalType type;
    BigDecimal price;
    LocalDate date;
    double confidence;
    StrategyKind strategy;
    @Singular
    Map<String, Double> indicators;
    String reason;

    @Override
    public String toString() {
        return String.format(java.util.Locale.ROOT, "%s %s at %s (confidence %.2f) - %s",
                type, symbol, price, confidence, reason);
    }
}
