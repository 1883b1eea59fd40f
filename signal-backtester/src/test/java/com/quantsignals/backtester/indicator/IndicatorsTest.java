package com.quantsignals.backtester.indicator;

import com.quantsignals.backtester.domain.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Indicators and the incremental calculators behind them.
 */
class IndicatorsTest {

    @Test
    void testRsi_StaysWithinRange() {
        double[] close = oscillatingPrices(120);

        IndicatorSeries rsi = Indicators.rsi(close, 14);

        assertEquals(close.length, rsi.size());
        assertFalse(rsi.isDefined(13), "RSI needs 14 changes before the first value");
        assertTrue(rsi.isDefined(14));
        for (int i = 14; i < close.length; i++) {
            double value = rsi.valueAt(i);
            assertTrue(value >= 0.0 && value <= 100.0, "RSI out of range at " + i + ": " + value);
        }
    }

    @Test
    void testRsi_NoLossesIsExactly100() {
        double[] close = new double[30];
        for (int i = 0; i < close.length; i++) {
            close[i] = 50.0 + i;
        }

        IndicatorSeries rsi = Indicators.rsi(close, 14);

        for (int i = 14; i < close.length; i++) {
            assertEquals(100.0, rsi.valueAt(i), 0.0);
        }
    }

    @Test
    void testRsi_FlatPricesIsExactly100() {
        double[] close = new double[20];
        java.util.Arrays.fill(close, 100.0);

        assertEquals(100.0, Indicators.rsi(close, 14).latest(), 0.0);
    }

    @Test
    void testRsi_NoGainsIsZero() {
        double[] close = new double[20];
        for (int i = 0; i < close.length; i++) {
            close[i] = 100.0 - i;
        }

        assertEquals(0.0, Indicators.rsi(close, 14).latest(), 0.0);
    }

    @Test
    void testMacd_HistogramIsExactlyMacdMinusSignal() {
        double[] close = oscillatingPrices(200);

        Indicators.MacdSeries macd = Indicators.macd(close, 12, 26, 9);

        for (int i = 0; i < close.length; i++) {
            double expected = macd.getMacd().valueAt(i) - macd.getSignal().valueAt(i);
            assertEquals(expected, macd.getHistogram().valueAt(i), 0.0, "Histogram identity broken at " + i);
        }
    }

    @Test
    void testBollingerBands_OrderedWhereDefined() {
        double[] close = oscillatingPrices(100);

        Indicators.BollingerSeries bands = Indicators.bollingerBands(close, 20, 2.0);

        assertFalse(bands.getMiddle().isDefined(18));
        for (int i = 19; i < close.length; i++) {
            double upper = bands.getUpper().valueAt(i);
            double middle = bands.getMiddle().valueAt(i);
            double lower = bands.getLower().valueAt(i);
            assertTrue(upper >= middle && middle >= lower, "Bands out of order at " + i);
        }
    }

    @Test
    void testBollingerBands_UseSampleStandardDeviation() {
        // mean 3, sample variance 2.5
        double[] close = {1, 2, 3, 4, 5};

        Indicators.BollingerSeries bands = Indicators.bollingerBands(close, 5, 2.0);

        assertEquals(3.0, bands.getMiddle().latest(), 1e-12);
        assertEquals(3.0 + 2 * Math.sqrt(2.5), bands.getUpper().latest(), 1e-12);
        assertEquals(3.0 - 2 * Math.sqrt(2.5), bands.getLower().latest(), 1e-12);
    }

    @Test
    void testSma_WarmUpThenRollingMean() {
        IndicatorSeries sma = Indicators.sma(new double[]{1, 2, 3, 4, 5}, 3);

        assertFalse(sma.isDefined(0));
        assertFalse(sma.isDefined(1));
        assertEquals(2.0, sma.valueAt(2), 0.0);
        assertEquals(3.0, sma.valueAt(3), 0.0);
        assertEquals(4.0, sma.valueAt(4), 0.0);
    }

    @Test
    void testEma_SeededWithFirstValue() {
        // alpha = 2 / (3 + 1) = 0.5
        IndicatorSeries ema = Indicators.ema(new double[]{10, 20, 20}, 3);

        assertEquals(10.0, ema.valueAt(0), 0.0);
        assertEquals(15.0, ema.valueAt(1), 0.0);
        assertEquals(17.5, ema.valueAt(2), 0.0);
    }

    @Test
    void testStochastic_ZeroRangeIsUndefined() {
        double[] flat = new double[20];
        java.util.Arrays.fill(flat, 100.0);

        Indicators.StochasticSeries stochastic = Indicators.stochastic(flat, flat, flat, 14, 3);

        assertFalse(stochastic.getK().isDefined(19));
        assertFalse(stochastic.getD().isDefined(19));
    }

    @Test
    void testStochasticAndWilliams_Bounds() {
        double[] close = oscillatingPrices(80);
        double[] high = new double[close.length];
        double[] low = new double[close.length];
        for (int i = 0; i < close.length; i++) {
            high[i] = close[i] + 1.5;
            low[i] = close[i] - 1.0;
        }

        Indicators.StochasticSeries stochastic = Indicators.stochastic(high, low, close, 14, 3);
        IndicatorSeries williams = Indicators.williamsR(high, low, close, 14);

        for (int i = 16; i < close.length; i++) {
            double k = stochastic.getK().valueAt(i);
            double r = williams.valueAt(i);
            assertTrue(k >= 0 && k <= 100, "%K out of range at " + i);
            assertTrue(r >= -100 && r <= 0, "%R out of range at " + i);
            assertEquals(k - 100.0, r, 1e-9, "%R is %K shifted by -100 for equal periods");
        }
    }

    @Test
    void testAtr_FirstTrueRangeIsHighMinusLow() {
        double[] high = {12, 15};
        double[] low = {10, 13};
        double[] close = {11, 14};

        IndicatorSeries atr = Indicators.atr(high, low, close, 1);

        assertEquals(2.0, atr.valueAt(0), 0.0);
        // max(15 - 13, |15 - 11|, |13 - 11|)
        assertEquals(4.0, atr.valueAt(1), 0.0);
    }

    @Test
    void testEmptyInput_ReturnsEmptySeries() {
        double[] empty = new double[0];

        assertTrue(Indicators.rsi(empty, 14).isEmpty());
        assertTrue(Indicators.sma(empty, 10).isEmpty());
        assertTrue(Indicators.macd(empty, 12, 26, 9).getHistogram().isEmpty());
        assertTrue(Indicators.bollingerBands(empty, 20, 2.0).getUpper().isEmpty());
        assertTrue(Indicators.atr(empty, empty, empty, 14).isEmpty());
    }

    @Test
    void testNonPositivePeriod_ThrowsInvalidConfiguration() {
        double[] close = {1, 2, 3};

        assertThrows(InvalidConfigurationException.class, () -> Indicators.rsi(close, 0));
        assertThrows(InvalidConfigurationException.class, () -> Indicators.sma(close, -1));
        assertThrows(InvalidConfigurationException.class, () -> Indicators.bollingerBands(close, 20, 0.0));
    }

    @Test
    void testValueAt_WarmUpThrowsInsufficientData() {
        IndicatorSeries rsi = Indicators.rsi(new double[]{1, 2, 3}, 14);

        assertThrows(InsufficientDataException.class, () -> rsi.valueAt(2));
        assertThrows(InsufficientDataException.class, rsi::latest);
    }

    @Test
    void testBatchAndIncremental_AgreeExactly() {
        double[] close = oscillatingPrices(150);
        RelativeStrengthIndex rsi = new RelativeStrengthIndex(14);
        MovingAverageConvergenceDivergence macd = new MovingAverageConvergenceDivergence(12, 26, 9);
        BollingerBandCalculator bollinger = new BollingerBandCalculator(20, 2.0);

        IndicatorSeries batchRsi = Indicators.rsi(close, 14);
        Indicators.MacdSeries batchMacd = Indicators.macd(close, 12, 26, 9);
        Indicators.BollingerSeries batchBands = Indicators.bollingerBands(close, 20, 2.0);

        for (int i = 0; i < close.length; i++) {
            double streamedRsi = rsi.next(close[i]);
            MovingAverageConvergenceDivergence.Point point = macd.next(close[i]);
            BollingerBandCalculator.Band band = bollinger.next(close[i]);

            assertEquals(batchRsi.toArray()[i], streamedRsi, 0.0);
            assertEquals(batchMacd.getMacd().toArray()[i], point.getMacd(), 0.0);
            assertEquals(batchBands.getUpper().toArray()[i], band.getUpper(), 0.0);
        }
    }

    private static double[] oscillatingPrices(int length) {
        double[] prices = new double[length];
        for (int i = 0; i < length; i++) {
            prices[i] = 100.0 + 10.0 * Math.sin(i / 5.0) + 3.0 * Math.cos(i / 1.7) + i * 0.05;
        }
        return prices;
    }
}
