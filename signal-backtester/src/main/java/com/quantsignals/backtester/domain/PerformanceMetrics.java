package com.quantsignals.backtester.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Risk and return figures derived from a {@link BacktestResult}.
 * Percentages are expressed in percent (12.5 means 12.5%).
 */
@Value
@Builder
public class PerformanceMetrics {

    BigDecimal totalReturn;
    BigDecimal totalReturnPct;
    BigDecimal sharpeRatio;
    BigDecimal maxDrawdown;
    BigDecimal winRate;
    BigDecimal volatility;
    int totalTrades;
    int profitableTrades;
    int losingTrades;
}
