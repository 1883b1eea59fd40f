package com.quantsignals.backtester.signal;

import com.quantsignals.backtester.domain.SignalType;
import com.quantsignals.backtester.domain.StrategyKind;

import java.util.Optional;

/**
 * Signals when the MACD line crosses its signal line between the previous bar
 * and the current one.
 */
public class MacdCrossoverStrategy implements Strategy {

    static final double CONFIDENCE = 0.7;

    @Override
    public Optional<SignalCandidate> evaluate(IndicatorSnapshot snapshot) {
        double macd = snapshot.current(IndicatorKey.MACD);
        double signal = snapshot.current(IndicatorKey.MACD_SIGNAL);
        double previousMacd = snapshot.previous(IndicatorKey.MACD);
        double previousSignal = snapshot.previous(IndicatorKey.MACD_SIGNAL);

        if (previousMacd <= previousSignal && macd > signal) {
            return Optional.of(candidate(SignalType.BUY, macd, signal, "MACD bullish crossover"));
        }
        if (previousMacd >= previousSignal && macd < signal) {
            return Optional.of(candidate(SignalType.SELL, macd, signal, "MACD bearish crossover"));
        }
        return Optional.empty();
    }

    private SignalCandidate candidate(SignalType type, double macd, double signal, String reason) {
        return SignalCandidate.builder()
                .type(type)
                .strategy(StrategyKind.MACD)
                .confidence(CONFIDENCE)
                .indicator(IndicatorKey.MACD.getKey(), macd)
                .indicator(IndicatorKey.MACD_SIGNAL.getKey(), signal)
                .reason(reason)
                .build();
    }

    @Override
    public StrategyKind getKind() {
        return StrategyKind.MACD;
    }

    @Override
    public String getName() {
        return "MacdCrossover";
    }
}
