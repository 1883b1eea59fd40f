package com.quantsignals.backtester.domain;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Calculator for backtest performance metrics.
 * Every method is a pure function of its input.
 */
public final class MetricsCalculator {

    static final int TRADING_DAYS_PER_YEAR = 252;
    private static final int SCALE = 4;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private MetricsCalculator() {
    }

    public static PerformanceMetrics calculate(BacktestResult result) {
        List<BigDecimal> values = result.getEquityCurve().stream()
                .map(EquityPoint::getValue)
                .toList();
        List<Double> returns = calculateDailyReturns(values);
        List<Trade> trades = result.getTrades();
        int profitable = (int) trades.stream().filter(Trade::isProfitable).count();
        int losing = (int) trades.stream().filter(trade -> trade.getProfit().signum() < 0).count();

        return PerformanceMetrics.builder()
                .totalReturn(result.getFinalCapital().subtract(result.getInitialCapital()))
                .totalReturnPct(calculateTotalReturnPct(result.getInitialCapital(), result.getFinalCapital()))
                .sharpeRatio(calculateSharpeRatio(returns))
                .volatility(calculateVolatility(returns))
                .maxDrawdown(calculateMaxDrawdown(values))
                .winRate(calculateWinRate(profitable, trades.size()))
                .totalTrades(trades.size())
                .profitableTrades(profitable)
                .losingTrades(losing)
                .build();
    }

    /**
     * Calculate total return percentage.
     */
    public static BigDecimal calculateTotalReturnPct(BigDecimal initialCapital, BigDecimal finalCapital) {
        if (initialCapital.signum() == 0) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        return finalCapital.subtract(initialCapital)
                .multiply(HUNDRED)
                .divide(initialCapital, SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Percentage change between consecutive values. Steps from a zero value are skipped.
     */
    public static List<Double> calculateDailyReturns(List<BigDecimal> values) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < values.size(); i++) {
            BigDecimal previous = values.get(i - 1);
            if (previous.signum() == 0) {
                continue;
            }
            returns.add(values.get(i).subtract(previous).divide(previous, MathContext.DECIMAL64).doubleValue());
        }
        return returns;
    }

    /**
     * Annualised Sharpe ratio with a zero risk-free rate, using the sample
     * standard deviation. Zero when fewer than two returns or no dispersion.
     */
    public static BigDecimal calculateSharpeRatio(List<Double> returns) {
        double stdDev = sampleStdDev(returns);
        if (returns.size() < 2 || stdDev == 0 || Double.isNaN(stdDev)) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        double sharpe = mean(returns) / stdDev * Math.sqrt(TRADING_DAYS_PER_YEAR);
        return BigDecimal.valueOf(sharpe).setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Annualised volatility of the returns, in percent.
     */
    public static BigDecimal calculateVolatility(List<Double> returns) {
        double stdDev = sampleStdDev(returns);
        if (Double.isNaN(stdDev)) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        return BigDecimal.valueOf(stdDev * Math.sqrt(TRADING_DAYS_PER_YEAR) * 100)
                .setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Calculate maximum drawdown percentage (zero or negative).
     */
    public static BigDecimal calculateMaxDrawdown(List<BigDecimal> values) {
        BigDecimal maxDrawdown = BigDecimal.ZERO.setScale(SCALE);
        if (values.isEmpty()) {
            return maxDrawdown;
        }

        BigDecimal peak = values.get(0);
        for (BigDecimal value : values) {
            if (value.compareTo(peak) > 0) {
                peak = value;
            }
            if (peak.signum() > 0) {
                BigDecimal drawdown = value.subtract(peak)
                        .multiply(HUNDRED)
                        .divide(peak, SCALE, RoundingMode.HALF_UP);
                if (drawdown.compareTo(maxDrawdown) < 0) {
                    maxDrawdown = drawdown;
                }
            }
        }
        return maxDrawdown;
    }

    /**
     * Calculate win rate as a percentage of closed trades.
     */
    public static BigDecimal calculateWinRate(int profitableTrades, int totalTrades) {
        if (totalTrades == 0) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        return BigDecimal.valueOf(profitableTrades)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(totalTrades), SCALE, RoundingMode.HALF_UP);
    }

    private static double mean(List<Double> values) {
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    private static double sampleStdDev(List<Double> values) {
        if (values.size() < 2) {
            return Double.NaN;
        }
        double mean = mean(values);
        double squares = 0;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }
        return Math.sqrt(squares / (values.size() - 1));
    }
}
