package com.quantsignals.backtester.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of a single-symbol backtest. The equity curve holds one point per
 * distinct, increasing bar date, valued at that bar's close before the
 * end-of-run closure. An incomplete bar carries the previous value forward.
 */
@Value
@Builder(toBuilder = true)
public class BacktestResult {

    String symbol;
    BigDecimal initialCapital;
    BigDecimal finalCapital;
    List<EquityPoint> equityCurve;
    List<Trade> trades;
    int skippedBars;
    int signalsGenerated;
    PerformanceMetrics metrics;
}
