package com.quantsignals.backtester.indicator;

import com.quantsignals.backtester.domain.InvalidConfigurationException;
import lombok.Value;

/**
 * Incremental Bollinger Bands: SMA middle band, upper and lower bands at
 * {@code k} sample standard deviations.
 */
public class BollingerBandCalculator {

    private final RollingWindow window;
    private final double multiplier;

    public BollingerBandCalculator(int period, double multiplier) {
        Indicators.requirePositive("Bollinger period", period);
        if (multiplier <= 0 || Double.isNaN(multiplier)) {
            throw new InvalidConfigurationException("Bollinger multiplier must be positive, got " + multiplier);
        }
        this.window = new RollingWindow(period);
        this.multiplier = multiplier;
    }

    public Band next(double close) {
        window.add(close);
        if (!window.isFull()) {
            return Band.UNDEFINED;
        }
        double middle = window.mean();
        double width = multiplier * window.sampleStdDev();
        return new Band(middle + width, middle, middle - width);
    }

    @Value
    public static class Band {
        static final Band UNDEFINED = new Band(Double.NaN, Double.NaN, Double.NaN);

        double upper;
        double middle;
        double lower;
    }
}
