package com.quantsignals.backtester.signal;

import com.quantsignals.backtester.domain.SignalType;
import com.quantsignals.backtester.domain.StrategyKind;

import java.util.Optional;

/**
 * Buys on a touch of the lower band and sells on a touch of the upper band.
 * A zero-width band (no price variation in the window) never triggers.
 */
public class BollingerBandStrategy implements Strategy {

    static final double CONFIDENCE = 0.6;

    @Override
    public Optional<SignalCandidate> evaluate(IndicatorSnapshot snapshot) {
        double upper = snapshot.current(IndicatorKey.BB_UPPER);
        double lower = snapshot.current(IndicatorKey.BB_LOWER);
        double close = snapshot.closeValue();

        if (upper <= lower) {
            return Optional.empty();
        }
        if (close <= lower) {
            return Optional.of(candidate(SignalType.BUY, close, upper, lower, "Price at Bollinger lower band"));
        }
        if (close >= upper) {
            return Optional.of(candidate(SignalType.SELL, close, upper, lower, "Price at Bollinger upper band"));
        }
        return Optional.empty();
    }

    private SignalCandidate candidate(SignalType type, double close, double upper, double lower, String reason) {
        return SignalCandidate.builder()
                .type(type)
                .strategy(StrategyKind.BOLLINGER)
                .confidence(CONFIDENCE)
                .indicator("close", close)
                .indicator(IndicatorKey.BB_UPPER.getKey(), upper)
                .indicator(IndicatorKey.BB_LOWER.getKey(), lower)
                .reason(reason)
                .build();
    }

    @Override
    public StrategyKind getKind() {
        return StrategyKind.BOLLINGER;
    }

    @Override
    public String getName() {
        return "BollingerBand";
    }
}
