package com.quantsignals.backtester.indicator;

import com.quantsignals.backtester.domain.InvalidConfigurationException;
import lombok.Value;

/**
 * Pure indicator transforms over whole price series.
 * Every transform runs the same incremental calculator used for streaming
 * replay, so batch and bar-by-bar values are identical.
 */
public final class Indicators {

    private Indicators() {
    }

    public static IndicatorSeries sma(double[] values, int period) {
        SimpleMovingAverage sma = new SimpleMovingAverage(period);
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = sma.next(values[i]);
        }
        return new IndicatorSeries("SMA(" + period + ")", out);
    }

    public static IndicatorSeries ema(double[] values, int period) {
        ExponentialMovingAverage ema = new ExponentialMovingAverage(period);
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = ema.next(values[i]);
        }
        return new IndicatorSeries("EMA(" + period + ")", out);
    }

    public static IndicatorSeries rsi(double[] close, int period) {
        RelativeStrengthIndex rsi = new RelativeStrengthIndex(period);
        double[] out = new double[close.length];
        for (int i = 0; i < close.length; i++) {
            out[i] = rsi.next(close[i]);
        }
        return new IndicatorSeries("RSI(" + period + ")", out);
    }

    public static MacdSeries macd(double[] close, int fast, int slow, int signal) {
        MovingAverageConvergenceDivergence calculator = new MovingAverageConvergenceDivergence(fast, slow, signal);
        double[] macd = new double[close.length];
        double[] signalLine = new double[close.length];
        double[] histogram = new double[close.length];
        for (int i = 0; i < close.length; i++) {
            MovingAverageConvergenceDivergence.Point point = calculator.next(close[i]);
            macd[i] = point.getMacd();
            signalLine[i] = point.getSignal();
            histogram[i] = point.getHistogram();
        }
        return new MacdSeries(
                new IndicatorSeries("MACD", macd),
                new IndicatorSeries("MACD signal", signalLine),
                new IndicatorSeries("MACD histogram", histogram));
    }

    public static BollingerSeries bollingerBands(double[] close, int period, double multiplier) {
        BollingerBandCalculator calculator = new BollingerBandCalculator(period, multiplier);
        double[] upper = new double[close.length];
        double[] middle = new double[close.length];
        double[] lower = new double[close.length];
        for (int i = 0; i < close.length; i++) {
            BollingerBandCalculator.Band band = calculator.next(close[i]);
            upper[i] = band.getUpper();
            middle[i] = band.getMiddle();
            lower[i] = band.getLower();
        }
        return new BollingerSeries(
                new IndicatorSeries("BB upper", upper),
                new IndicatorSeries("BB middle", middle),
                new IndicatorSeries("BB lower", lower));
    }

    public static StochasticSeries stochastic(double[] high, double[] low, double[] close, int kPeriod, int dPeriod) {
        requireSameLength(high, low, close);
        StochasticOscillator oscillator = new StochasticOscillator(kPeriod, dPeriod);
        double[] k = new double[close.length];
        double[] d = new double[close.length];
        for (int i = 0; i < close.length; i++) {
            StochasticOscillator.Point point = oscillator.next(high[i], low[i], close[i]);
            k[i] = point.getK();
            d[i] = point.getD();
        }
        return new StochasticSeries(new IndicatorSeries("%K", k), new IndicatorSeries("%D", d));
    }

    public static IndicatorSeries williamsR(double[] high, double[] low, double[] close, int period) {
        requireSameLength(high, low, close);
        WilliamsPercentR williams = new WilliamsPercentR(period);
        double[] out = new double[close.length];
        for (int i = 0; i < close.length; i++) {
            out[i] = williams.next(high[i], low[i], close[i]);
        }
        return new IndicatorSeries("Williams %R(" + period + ")", out);
    }

    public static IndicatorSeries atr(double[] high, double[] low, double[] close, int period) {
        requireSameLength(high, low, close);
        AverageTrueRange atr = new AverageTrueRange(period);
        double[] out = new double[close.length];
        for (int i = 0; i < close.length; i++) {
            out[i] = atr.next(high[i], low[i], close[i]);
        }
        return new IndicatorSeries("ATR(" + period + ")", out);
    }

    static void requirePositive(String name, int period) {
        if (period <= 0) {
            throw new InvalidConfigurationException(name + " must be positive, got " + period);
        }
    }

    private static void requireSameLength(double[] high, double[] low, double[] close) {
        if (high.length != close.length || low.length != close.length) {
            throw new IllegalArgumentException("High, low and close series must have the same length");
        }
    }

    @Value
    public static class MacdSeries {
        IndicatorSeries macd;
        IndicatorSeries signal;
        IndicatorSeries histogram;
    }

    @Value
    public static class BollingerSeries {
        IndicatorSeries upper;
        IndicatorSeries middle;
        IndicatorSeries lower;
    }

    @Value
    public static class StochasticSeries {
        IndicatorSeries k;
        IndicatorSeries d;
    }
}
