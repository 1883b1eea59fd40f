package com.quantsignals.backtester.indicator;

import lombok.Value;

/**
 * Incremental stochastic oscillator (%K over {@code kPeriod} bars, %D as the SMA
 * of %K over {@code dPeriod}). A window with no high-low range leaves %K undefined.
 */
public class StochasticOscillator {

    private final RollingWindow highs;
    private final RollingWindow lows;
    private final SimpleMovingAverage percentD;

    public StochasticOscillator(int kPeriod, int dPeriod) {
        Indicators.requirePositive("Stochastic %K period", kPeriod);
        this.highs = new RollingWindow(kPeriod);
        this.lows = new RollingWindow(kPeriod);
        this.percentD = new SimpleMovingAverage(dPeriod);
    }

    public Point next(double high, double low, double close) {
        highs.add(high);
        lows.add(low);

        double k = Double.NaN;
        if (highs.isFull()) {
            double highest = highs.max();
            double lowest = lows.min();
            if (highest > lowest) {
                k = (close - lowest) / (highest - lowest) * 100.0;
            }
        }
        return new Point(k, percentD.next(k));
    }

    @Value
    public static class Point {
        double k;
        double d;
    }
}
