package com.quantsignals.backtester.signal;

import com.quantsignals.backtester.domain.Bar;
import com.quantsignals.backtester.domain.InvalidConfigurationException;
import com.quantsignals.backtester.domain.Signal;
import com.quantsignals.backtester.domain.SignalSource;
import com.quantsignals.backtester.domain.SignalType;
import com.quantsignals.backtester.domain.StrategyKind;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SignalGenerator.
 */
class SignalGeneratorTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    @Test
    void testFlatPrices_HoldOnEveryBar() {
        // Arrange - 30 bars at a constant 100.0
        SignalGenerator generator = new SignalGenerator(SignalConfig.defaults());
        SignalSource session = generator.openSession("FLAT");
        List<Bar> bars = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            bars.add(createBar(i, 100.0));
        }

        // Act & Assert
        for (Bar bar : bars) {
            assertTrue(session.onBar(bar).isEmpty(), "Flat prices should hold on " + bar.getDate());
        }
        assertTrue(generator.generate("FLAT", bars).isEmpty());
    }

    @Test
    void testGoldenCrossAfterDecline_ExactlyOneBuyAtCrossoverBar() {
        // Arrange - RSI thresholds at the extremes so only the crossover rules can buy
        SignalConfig config = SignalConfig.builder()
                .rsiOversold(0)
                .rsiOverbought(100)
                .build();
        SignalGenerator generator = new SignalGenerator(config);
        SignalSource session = generator.openSession("VSHAPE");
        List<Bar> bars = vShapedBars();

        // Act
        List<Integer> buyIndexes = new ArrayList<>();
        Signal buy = null;
        for (int i = 0; i < bars.size(); i++) {
            Optional<Signal> signal = session.onBar(bars.get(i));
            if (signal.isPresent() && signal.get().getType() == SignalType.BUY) {
                buyIndexes.add(i);
                buy = signal.get();
            }
        }

        // Assert - SMA10 crosses SMA50 between bar 50 (76.5 < 78.9) and bar 51 (79.5 > 78.78)
        assertEquals(List.of(51), buyIndexes, "Expected a single BUY at the golden cross");
        assertEquals(StrategyKind.MA_CROSS, buy.getStrategy());
        assertEquals(0.8, buy.getConfidence(), 0.0);
        assertEquals(0, new BigDecimal("93.0").compareTo(buy.getPrice()));
        assertEquals(START.plusDays(51), buy.getDate());
        assertEquals("VSHAPE", buy.getSymbol());
        assertTrue(buy.getIndicators().containsKey("sma_short"));
    }

    @Test
    void testSteadyRise_RsiSellsAndNoCrossoverIsSeen() {
        // Arrange - 60 bars rising linearly from 50 to 150, default settings
        SignalSource session = new SignalGenerator(SignalConfig.defaults()).openSession("RAMP");
        List<Bar> bars = new ArrayList<>();
        for (int t = 0; t < 60; t++) {
            bars.add(createBar(t, 50.0 + 100.0 * t / 59.0));
        }

        // Act
        List<Integer> signalIndexes = new ArrayList<>();
        for (int i = 0; i < bars.size(); i++) {
            Optional<Signal> signal = session.onBar(bars.get(i));
            if (signal.isPresent()) {
                signalIndexes.add(i);
                // SMA(10) is above SMA(50) from the first bar both exist, so no cross is ever observed,
                // and RSI without losses is 100, which outranks any crossover
                assertEquals(SignalType.SELL, signal.get().getType(), "Unexpected signal at bar " + i);
                assertEquals(StrategyKind.RSI, signal.get().getStrategy());
                assertEquals(1.0, signal.get().getConfidence(), 0.0);
            }
        }

        // Assert - nothing before the 50-bar history gate, then RSI on every bar
        List<Integer> expected = new ArrayList<>();
        for (int i = 49; i < 60; i++) {
            expected.add(i);
        }
        assertEquals(expected, signalIndexes);
    }

    @Test
    void testGenerate_EvaluatesLastCompleteBar() {
        // Arrange - crossover bars followed by a bar with no close
        SignalConfig config = SignalConfig.builder().rsiOversold(0).rsiOverbought(100).build();
        SignalGenerator generator = new SignalGenerator(config);
        List<Bar> bars = new ArrayList<>(vShapedBars().subList(0, 52));
        Bar broken = createBar(52, 96.0);
        broken.setClose(null);
        bars.add(broken);

        // Act
        Optional<Signal> signal = generator.generate("VSHAPE", bars);

        // Assert
        assertTrue(signal.isPresent());
        assertEquals(SignalType.BUY, signal.get().getType());
        assertEquals(START.plusDays(51), signal.get().getDate());
    }

    @Test
    void testMinimumHistory_NothingEvaluatedBeforeGate() {
        SignalConfig config = SignalConfig.builder().minHistoryBars(60).rsiOversold(0).rsiOverbought(100).build();
        SignalSource session = new SignalGenerator(config).openSession("VSHAPE");

        for (Bar bar : vShapedBars()) {
            assertTrue(session.onBar(bar).isEmpty(), "No signal before 60 bars have been seen");
        }
    }

    @Test
    void testWarmUp_StrategiesAbstainWithoutFailing() {
        SignalConfig config = SignalConfig.builder().minHistoryBars(0).build();
        SignalSource session = new SignalGenerator(config).openSession("NEW");

        assertTrue(session.onBar(createBar(0, 100.0)).isEmpty(), "Nothing is defined after one bar");
        assertDoesNotThrow(() -> session.onBar(createBar(1, 101.0)));
    }

    @Test
    void testCombine_HighestConfidenceWins() {
        List<SignalCandidate> candidates = List.of(
                candidate(SignalType.BUY, StrategyKind.MA_CROSS, 0.8),
                candidate(SignalType.SELL, StrategyKind.RSI, 1.0));

        SignalCandidate best = SignalGenerator.combine(candidates).orElseThrow();

        assertEquals(SignalType.SELL, best.getType());
        assertEquals(StrategyKind.RSI, best.getStrategy());
    }

    @Test
    void testCombine_TiesBrokenByStrategyPriority() {
        SignalCandidate macdBuy = candidate(SignalType.BUY, StrategyKind.MACD, 0.7);
        SignalCandidate rsiSell = candidate(SignalType.SELL, StrategyKind.RSI, 0.7);
        SignalCandidate bollingerBuy = candidate(SignalType.BUY, StrategyKind.BOLLINGER, 0.6);
        SignalCandidate rsiBuy = candidate(SignalType.BUY, StrategyKind.RSI, 0.6);

        assertEquals(StrategyKind.MACD, SignalGenerator.combine(List.of(rsiSell, macdBuy)).orElseThrow().getStrategy());
        assertEquals(StrategyKind.RSI, SignalGenerator.combine(List.of(bollingerBuy, rsiBuy)).orElseThrow().getStrategy());
    }

    @Test
    void testCombine_NoCandidatesIsHold() {
        assertTrue(SignalGenerator.combine(List.of()).isEmpty());
    }

    @Test
    void testInvalidConfiguration_FailsAtConstruction() {
        assertThrows(InvalidConfigurationException.class, () -> new SignalGenerator(
                SignalConfig.builder().rsiOversold(70).rsiOverbought(30).build()));
        assertThrows(InvalidConfigurationException.class, () -> new SignalGenerator(
                SignalConfig.builder().rsiOverbought(120).build()));
        assertThrows(InvalidConfigurationException.class, () -> new SignalGenerator(
                SignalConfig.builder().smaShort(50).smaLong(50).build()));
        assertThrows(InvalidConfigurationException.class, () -> new SignalGenerator(
                SignalConfig.builder().rsiPeriod(0).build()));
    }

    /**
     * Falls from 100 to 60 over 41 bars, then climbs 3 per bar to 117.
     */
    private static List<Bar> vShapedBars() {
        List<Bar> bars = new ArrayList<>();
        for (int t = 0; t < 60; t++) {
            double close = t <= 40 ? 100.0 - t : 60.0 + 3.0 * (t - 40);
            bars.add(createBar(t, close));
        }
        return bars;
    }

    private static SignalCandidate candidate(SignalType type, StrategyKind strategy, double confidence) {
        return SignalCandidate.builder()
                .type(type)
                .strategy(strategy)
                .confidence(confidence)
                .reason(strategy.getLabel())
                .build();
    }

    private static Bar createBar(int day, double close) {
        BigDecimal price = BigDecimal.valueOf(close);
        return Bar.builder()
                .symbol("TEST")
                .date(START.plusDays(day))
                .open(price)
                .high(price.add(BigDecimal.ONE))
                .low(price.subtract(BigDecimal.ONE))
                .close(price)
                .volume(1_000_000L)
                .build();
    }
}
