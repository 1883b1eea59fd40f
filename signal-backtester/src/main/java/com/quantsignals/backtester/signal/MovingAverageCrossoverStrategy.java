package com.quantsignals.backtester.signal;

import com.quantsignals.backtester.domain.InvalidConfigurationException;
import com.quantsignals.backtester.domain.SignalType;
import com.quantsignals.backtester.domain.StrategyKind;

import java.util.Optional;

/**
 * Moving Average Crossover Strategy.
 * Buys when the short SMA crosses above the long SMA (golden cross), sells
 * when it crosses below (death cross).
 */
public class MovingAverageCrossoverStrategy implements Strategy {

    static final double CONFIDENCE = 0.8;

    private final int shortPeriod;
    private final int longPeriod;

    public MovingAverageCrossoverStrategy(int shortPeriod, int longPeriod) {
        if (shortPeriod >= longPeriod) {
            throw new InvalidConfigurationException("Short period must be less than long period");
        }
        this.shortPeriod = shortPeriod;
        this.longPeriod = longPeriod;
    }

    @Override
    public Optional<SignalCandidate> evaluate(IndicatorSnapshot snapshot) {
        double shortMA = snapshot.current(IndicatorKey.SMA_SHORT);
        double longMA = snapshot.current(IndicatorKey.SMA_LONG);
        double previousShortMA = snapshot.previous(IndicatorKey.SMA_SHORT);
        double previousLongMA = snapshot.previous(IndicatorKey.SMA_LONG);

        // Golden cross
        if (previousShortMA <= previousLongMA && shortMA > longMA) {
            return Optional.of(candidate(SignalType.BUY, shortMA, longMA,
                    "Golden cross: SMA" + shortPeriod + " above SMA" + longPeriod));
        }
        // Death cross
        if (previousShortMA >= previousLongMA && shortMA < longMA) {
            return Optional.of(candidate(SignalType.SELL, shortMA, longMA,
                    "Death cross: SMA" + shortPeriod + " below SMA" + longPeriod));
        }
        return Optional.empty();
    }

    private SignalCandidate candidate(SignalType type, double shortMA, double longMA, String reason) {
        return SignalCandidate.builder()
                .type(type)
                .strategy(StrategyKind.MA_CROSS)
                .confidence(CONFIDENCE)
                .indicator(IndicatorKey.SMA_SHORT.getKey(), shortMA)
                .indicator(IndicatorKey.SMA_LONG.getKey(), longMA)
                .reason(reason)
                .build();
    }

    @Override
    public StrategyKind getKind() {
        return StrategyKind.MA_CROSS;
    }

    @Override
    public String getName() {
        return "MovingAverageCrossover(" + shortPeriod + "," + longPeriod + ")";
    }
}
