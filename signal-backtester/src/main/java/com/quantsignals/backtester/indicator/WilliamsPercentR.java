package com.quantsignals.backtester.indicator;

/**
 * Incremental Williams %R in the range [-100, 0].
 */
public class WilliamsPercentR {

    private final RollingWindow highs;
    private final RollingWindow lows;

    public WilliamsPercentR(int period) {
        Indicators.requirePositive("Williams %R period", period);
        this.highs = new RollingWindow(period);
        this.lows = new RollingWindow(period);
    }

    public double next(double high, double low, double close) {
        highs.add(high);
        lows.add(low);
        if (!highs.isFull()) {
            return Double.NaN;
        }
        double highest = highs.max();
        double lowest = lows.min();
        if (highest <= lowest) {
            return Double.NaN;
        }
        return -100.0 * (highest - close) / (highest - lowest);
    }
}
