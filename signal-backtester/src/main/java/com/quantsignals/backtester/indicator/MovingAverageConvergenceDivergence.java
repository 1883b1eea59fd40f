package com.quantsignals.backtester.indicator;

import lombok.Value;

/**
 * Incremental MACD: fast EMA minus slow EMA, with an EMA signal line over the
 * MACD line. The histogram is always exactly {@code macd - signal}.
 */
public class MovingAverageConvergenceDivergence {

    private final ExponentialMovingAverage fast;
    private final ExponentialMovingAverage slow;
    private final ExponentialMovingAverage signal;

    public MovingAverageConvergenceDivergence(int fastPeriod, int slowPeriod, int signalPeriod) {
        this.fast = new ExponentialMovingAverage(fastPeriod);
        this.slow = new ExponentialMovingAverage(slowPeriod);
        this.signal = new ExponentialMovingAverage(signalPeriod);
    }

    public Point next(double close) {
        double macd = fast.next(close) - slow.next(close);
        double signalLine = signal.next(macd);
        return new Point(macd, signalLine, macd - signalLine);
    }

    @Value
    public static class Point {
        double macd;
        double signal;
        double histogram;
    }
}
