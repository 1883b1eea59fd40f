package com.quantsignals.backtester.signal;

import com.quantsignals.backtester.domain.Bar;
import com.quantsignals.backtester.indicator.AverageTrueRange;
import com.quantsignals.backtester.indicator.BollingerBandCalculator;
import com.quantsignals.backtester.indicator.ExponentialMovingAverage;
import com.quantsignals.backtester.indicator.MovingAverageConvergenceDivergence;
import com.quantsignals.backtester.indicator.RelativeStrengthIndex;
import com.quantsignals.backtester.indicator.SimpleMovingAverage;
import com.quantsignals.backtester.indicator.StochasticOscillator;
import com.quantsignals.backtester.indicator.WilliamsPercentR;

import java.util.EnumMap;

/**
 * Incremental indicator state for one symbol. Each call to {@link #update(Bar)}
 * advances every calculator by one bar and keeps only their windows.
 * Not thread-safe; one instance belongs to one run.
 */
public class IndicatorState {

    private final RelativeStrengthIndex rsi;
    private final MovingAverageConvergenceDivergence macd;
    private final BollingerBandCalculator bollinger;
    private final SimpleMovingAverage smaShort;
    private final SimpleMovingAverage smaLong;
    private final ExponentialMovingAverage emaShort;
    private final ExponentialMovingAverage emaLong;
    private final StochasticOscillator stochastic;
    private final WilliamsPercentR williamsR;
    private final AverageTrueRange atr;

    private EnumMap<IndicatorKey, Double> lastValues = new EnumMap<>(IndicatorKey.class);
    private int barCount;

    public IndicatorState(SignalConfig config) {
        this.rsi = new RelativeStrengthIndex(config.getRsiPeriod());
        this.macd = new MovingAverageConvergenceDivergence(
                config.getMacdFast(), config.getMacdSlow(), config.getMacdSignal());
        this.bollinger = new BollingerBandCalculator(config.getBollingerPeriod(), config.getBollingerStdDev());
        this.smaShort = new SimpleMovingAverage(config.getSmaShort());
        this.smaLong = new SimpleMovingAverage(config.getSmaLong());
        this.emaShort = new ExponentialMovingAverage(config.getMacdFast());
        this.emaLong = new ExponentialMovingAverage(config.getMacdSlow());
        this.stochastic = new StochasticOscillator(config.getStochasticK(), config.getStochasticD());
        this.williamsR = new WilliamsPercentR(config.getWilliamsPeriod());
        this.atr = new AverageTrueRange(config.getAtrPeriod());
    }

    public IndicatorSnapshot update(Bar bar) {
        double close = bar.getClose().doubleValue();
        double high = bar.getHigh().doubleValue();
        double low = bar.getLow().doubleValue();

        EnumMap<IndicatorKey, Double> values = new EnumMap<>(IndicatorKey.class);
        values.put(IndicatorKey.RSI, rsi.next(close));

        MovingAverageConvergenceDivergence.Point macdPoint = macd.next(close);
        values.put(IndicatorKey.MACD, macdPoint.getMacd());
        values.put(IndicatorKey.MACD_SIGNAL, macdPoint.getSignal());
        values.put(IndicatorKey.MACD_HISTOGRAM, macdPoint.getHistogram());

        BollingerBandCalculator.Band band = bollinger.next(close);
        values.put(IndicatorKey.BB_UPPER, band.getUpper());
        values.put(IndicatorKey.BB_MIDDLE, band.getMiddle());
        values.put(IndicatorKey.BB_LOWER, band.getLower());

        values.put(IndicatorKey.SMA_SHORT, smaShort.next(close));
        values.put(IndicatorKey.SMA_LONG, smaLong.next(close));
        values.put(IndicatorKey.EMA_SHORT, emaShort.next(close));
        values.put(IndicatorKey.EMA_LONG, emaLong.next(close));

        StochasticOscillator.Point stoch = stochastic.next(high, low, close);
        values.put(IndicatorKey.STOCH_K, stoch.getK());
        values.put(IndicatorKey.STOCH_D, stoch.getD());
        values.put(IndicatorKey.WILLIAMS_R, williamsR.next(high, low, close));
        values.put(IndicatorKey.ATR, atr.next(high, low, close));

        barCount++;
        IndicatorSnapshot snapshot = new IndicatorSnapshot(bar.getDate(), bar.getClose(), barCount, values, lastValues);
        lastValues = values;
        return snapshot;
    }
}
