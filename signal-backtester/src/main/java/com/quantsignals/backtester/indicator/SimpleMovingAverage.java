package com.quantsignals.backtester.indicator;

/**
 * Incremental simple moving average. Undefined (NaN) until {@code period} values
 * have been seen, and NaN whenever an undefined value is inside the window.
 */
public class SimpleMovingAverage {

    private final RollingWindow window;

    public SimpleMovingAverage(int period) {
        Indicators.requirePositive("SMA period", period);
        this.window = new RollingWindow(period);
    }

    public double next(double value) {
        window.add(value);
        return window.isFull() ? window.mean() : Double.NaN;
    }
}
