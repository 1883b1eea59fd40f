package com.quantsignals.backtester.signal;

import com.quantsignals.backtester.domain.InvalidConfigurationException;
import lombok.Builder;
import lombok.Value;

/**
 * Indicator periods and strategy thresholds used by {@link SignalGenerator}.
 * Instances are immutable; {@link #validate()} is called before any use.
 */
@Value
@Builder(toBuilder = true)
public class SignalConfig {

    @Builder.Default
    int rsiPeriod = 14;
    @Builder.Default
    double rsiOversold = 30.0;
    @Builder.Default
    double rsiOverbought = 70.0;

    @Builder.Default
    int macdFast = 12;
    @Builder.Default
    int macdSlow = 26;
    @Builder.Default
    int macdSignal = 9;

    @Builder.Default
    int bollingerPeriod = 20;
    @Builder.Default
    double bollingerStdDev = 2.0;

    @Builder.Default
    int smaShort = 10;
    @Builder.Default
    int smaLong = 50;

    @Builder.Default
    int stochasticK = 14;
    @Builder.Default
    int stochasticD = 3;
    @Builder.Default
    int williamsPeriod = 14;
    @Builder.Default
    int atrPeriod = 14;

    /** Bars a symbol must have before any strategy is evaluated. */
    @Builder.Default
    int minHistoryBars = 50;

    public static SignalConfig defaults() {
        return SignalConfig.builder().build();
    }

    /**
     * @return this config
     * @throws InvalidConfigurationException on the first invalid setting
     */
    public SignalConfig validate() {
        requirePositive("rsiPeriod", rsiPeriod);
        requirePositive("macdFast", macdFast);
        requirePositive("macdSlow", macdSlow);
        requirePositive("macdSignal", macdSignal);
        requirePositive("smaShort", smaShort);
        requirePositive("smaLong", smaLong);
        requirePositive("stochasticK", stochasticK);
        requirePositive("stochasticD", stochasticD);
        requirePositive("williamsPeriod", williamsPeriod);
        requirePositive("atrPeriod", atrPeriod);

        if (bollingerPeriod < 2) {
            throw new InvalidConfigurationException("bollingerPeriod must be at least 2, got " + bollingerPeriod);
        }
        if (!(bollingerStdDev > 0)) {
            throw new InvalidConfigurationException("bollingerStdDev must be positive, got " + bollingerStdDev);
        }
        requireThreshold("rsiOversold", rsiOversold);
        requireThreshold("rsiOverbought", rsiOverbought);
        if (rsiOversold >= rsiOverbought) {
            throw new InvalidConfigurationException(String.format(
                    "rsiOversold (%s) must be below rsiOverbought (%s)", rsiOversold, rsiOverbought));
        }
        if (macdFast >= macdSlow) {
            throw new InvalidConfigurationException(String.format(
                    "macdFast (%d) must be less than macdSlow (%d)", macdFast, macdSlow));
        }
        if (smaShort >= smaLong) {
            throw new InvalidConfigurationException(String.format(
                    "smaShort (%d) must be less than smaLong (%d)", smaShort, smaLong));
        }
        if (minHistoryBars < 0) {
            throw new InvalidConfigurationException("minHistoryBars must not be negative, got " + minHistoryBars);
        }
        return this;
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new InvalidConfigurationException(name + " must be positive, got " + value);
        }
    }

    private static void requireThreshold(String name, double value) {
        if (Double.isNaN(value) || value < 0 || value > 100) {
            throw new InvalidConfigurationException(name + " must be within [0, 100], got " + value);
        }
    }
}
