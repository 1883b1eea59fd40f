package com.quantsignals.backtester.controller.dto;

import com.quantsignals.backtester.domain.BacktestResult;
import com.quantsignals.backtester.domain.EquityPoint;
import com.quantsignals.backtester.domain.PerformanceMetrics;
import com.quantsignals.backtester.domain.Trade;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Response DTO for a completed backtest.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestResponse {

    private String symbol;
    private BigDecimal initialCapital;
    private BigDecimal finalCapital;
    private int skippedBars;
    private int signalsGenerated;
    private PerformanceMetrics metrics;
    private List<Trade> trades;
    private List<EquityPoint> equityCurve;

    public static BacktestResponse from(BacktestResult result) {
        return BacktestResponse.builder()
                .symbol(result.getSymbol())
                .initialCapital(result.getInitialCapital())
                .finalCapital(result.getFinalCapital())
                .skippedBars(result.getSkippedBars())
                .signalsGenerated(result.getSignalsGenerated())
                .metrics(result.getMetrics())
                .trades(result.getTrades())
                .equityCurve(result.getEquityCurve())
                .build();
    }
}
