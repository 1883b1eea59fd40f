package com.quantsignals.backtester.signal;

import com.quantsignals.backtester.domain.SignalType;
import com.quantsignals.backtester.domain.StrategyKind;

import java.util.Locale;
import java.util.Optional;

/**
 * Buys below the oversold threshold and sells above the overbought threshold.
 * Confidence grows by 0.1 per RSI point past the threshold, capped at 1.
 */
public class RsiStrategy implements Strategy {

    private final double oversold;
    private final double overbought;

    public RsiStrategy(double oversold, double overbought) {
        this.oversold = oversold;
        this.overbought = overbought;
    }

    @Override
    public Optional<SignalCandidate> evaluate(IndicatorSnapshot snapshot) {
        double rsi = snapshot.current(IndicatorKey.RSI);

        if (rsi < oversold) {
            return Optional.of(candidate(SignalType.BUY, Math.min(1.0, (oversold - rsi) / 10.0), rsi,
                    String.format(Locale.ROOT, "RSI oversold at %.2f", rsi)));
        }
        if (rsi > overbought) {
            return Optional.of(candidate(SignalType.SELL, Math.min(1.0, (rsi - overbought) / 10.0), rsi,
                    String.format(Locale.ROOT, "RSI overbought at %.2f", rsi)));
        }
        return Optional.empty();
    }

    private SignalCandidate candidate(SignalType type, double confidence, double rsi, String reason) {
        return SignalCandidate.builder()
                .type(type)
                .strategy(StrategyKind.RSI)
                .confidence(confidence)
                .indicator(IndicatorKey.RSI.getKey(), rsi)
                .reason(reason)
                .build();
    }

    @Override
    public StrategyKind getKind() {
        return StrategyKind.RSI;
    }

    @Override
    public String getName() {
        return "RSI(" + oversold + "," + overbought + ")";
    }
}
