package com.quantsignals.backtester.indicator;

/**
 * Incremental RSI over the rolling mean of gains and losses of the last
 * {@code period} close-to-close changes. The first value is available on the
 * bar after {@code period} changes have been observed.
 */
public class RelativeStrengthIndex {

    private final RollingWindow gains;
    private final RollingWindow losses;
    private double previousClose = Double.NaN;

    public RelativeStrengthIndex(int period) {
        Indicators.requirePositive("RSI period", period);
        this.gains = new RollingWindow(period);
        this.losses = new RollingWindow(period);
    }

    public double next(double close) {
        if (Double.isNaN(previousClose)) {
            previousClose = close;
            return Double.NaN;
        }
        double change = close - previousClose;
        previousClose = close;

        gains.add(change > 0 ? change : 0.0);
        losses.add(change < 0 ? -change : 0.0);

        if (!gains.isFull()) {
            return Double.NaN;
        }

        double averageGain = gains.mean();
        double averageLoss = losses.mean();

        // No losses in the window: pinned at the top of the scale
        if (averageLoss == 0.0) {
            return 100.0;
        }
        double rs = averageGain / averageLoss;
        return 100.0 - 100.0 / (1.0 + rs);
    }
}
