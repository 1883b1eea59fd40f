package com.quantsignals.backtester.indicator;

/**
 * Incremental exponential moving average with smoothing factor 2 / (period + 1),
 * seeded with the first value it receives.
 */
public class ExponentialMovingAverage {

    private final double alpha;
    private double current = Double.NaN;

    public ExponentialMovingAverage(int period) {
        Indicators.requirePositive("EMA period", period);
        this.alpha = 2.0 / (period + 1);
    }

    public double next(double value) {
        if (Double.isNaN(current)) {
            current = value;
        } else {
            current = alpha * value + (1 - alpha) * current;
        }
        return current;
    }
}
