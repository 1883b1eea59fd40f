package com.quantsignals.backtester.indicator;

/**
 * Incremental ATR as the simple rolling mean of the true range.
 */
public class AverageTrueRange {

    private final SimpleMovingAverage average;
    private double previousClose = Double.NaN;

    public AverageTrueRange(int period) {
        this.average = new SimpleMovingAverage(period);
    }

    public double next(double high, double low, double close) {
        double trueRange = high - low;
        if (!Double.isNaN(previousClose)) {
            trueRange = Math.max(trueRange,
                    Math.max(Math.abs(high - previousClose), Math.abs(low - previousClose)));
        }
        previousClose = close;
        return average.next(trueRange);
    }
}
