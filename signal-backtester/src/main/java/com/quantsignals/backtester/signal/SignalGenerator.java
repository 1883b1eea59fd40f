package com.quantsignals.backtester.signal;

import com.quantsignals.backtester.domain.Bar;
import com.quantsignals.backtester.domain.Signal;
import com.quantsignals.backtester.domain.SignalSource;
import com.quantsignals.backtester.indicator.InsufficientDataException;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Runs the four indicator strategies over a snapshot and reduces their
 * candidates to at most one {@link Signal}.
 * <p>
 * The generator itself is stateless and can be shared between threads; the
 * per-symbol indicator state lives in sessions opened with
 * {@link #openSession(String)}.
 */
@Slf4j
public class SignalGenerator {

    private static final Comparator<SignalCandidate> RANKING = Comparator
            .comparingDouble(SignalCandidate::getConfidence)
            .thenComparingInt(candidate -> candidate.getStrategy().getPriority());

    private final SignalConfig config;
    private final List<Strategy> strategies;

    public SignalGenerator(SignalConfig config) {
        this.config = config.validate();
        this.strategies = List.of(
                new MovingAverageCrossoverStrategy(config.getSmaShort(), config.getSmaLong()),
                new MacdCrossoverStrategy(),
                new RsiStrategy(config.getRsiOversold(), config.getRsiOverbought()),
                new BollingerBandStrategy());
    }

    public SignalConfig getConfig() {
        return config;
    }

    /**
     * Evaluate all strategies against one snapshot.
     *
     * @return the winning signal, or empty for Hold
     */
    public Optional<Signal> evaluate(String symbol, IndicatorSnapshot snapshot) {
        if (snapshot.getBarCount() < config.getMinHistoryBars()) {
            return Optional.empty();
        }

        List<SignalCandidate> candidates = new ArrayList<>();
        for (Strategy strategy : strategies) {
            try {
                strategy.evaluate(snapshot).ifPresent(candidates::add);
            } catch (InsufficientDataException e) {
                log.trace("{} abstains for {} on {}: {}", strategy.getName(), symbol, snapshot.getDate(), e.getMessage());
            } catch (RuntimeException e) {
                log.warn("{} failed for {} on {}, abstaining", strategy.getName(), symbol, snapshot.getDate(), e);
            }
        }

        return combine(candidates).map(best -> toSignal(symbol, snapshot, best));
    }

    /**
     * Replay the bars through a fresh indicator state and evaluate the last
     * accepted bar. Incomplete and out-of-order bars are ignored.
     */
    public Optional<Signal> generate(String symbol, List<Bar> bars) {
        IndicatorState state = new IndicatorState(config);
        IndicatorSnapshot last = null;
        LocalDate lastDate = null;

        for (Bar bar : bars) {
            if (!bar.isComplete() || (lastDate != null && !bar.getDate().isAfter(lastDate))) {
                continue;
            }
            last = state.update(bar);
            lastDate = bar.getDate();
        }

        if (last == null) {
            log.debug("No usable bars for {}", symbol);
            return Optional.empty();
        }
        return evaluate(symbol, last);
    }

    /**
     * Open an incremental session for one backtest run over {@code symbol}.
     */
    public SignalSource openSession(String symbol) {
        IndicatorState state = new IndicatorState(config);
        return bar -> evaluate(symbol, state.update(bar));
    }

    /**
     * Pick one candidate: the highest confidence wins, ties go to the higher
     * priority strategy. When both sides are present this is the best of the
     * union, otherwise the best of the only side.
     */
    public static Optional<SignalCandidate> combine(List<SignalCandidate> candidates) {
        List<SignalCandidate> buys = new ArrayList<>();
        List<SignalCandidate> sells = new ArrayList<>();
        for (SignalCandidate candidate : candidates) {
            switch (candidate.getType()) {
                case BUY -> buys.add(candidate);
                case SELL -> sells.add(candidate);
            }
        }

        if (!buys.isEmpty() && !sells.isEmpty()) {
            return candidates.stream().max(RANKING);
        }
        if (!buys.isEmpty()) {
            return buys.stream().max(RANKING);
        }
        return sells.stream().max(RANKING);
    }

    private Signal toSignal(String symbol, IndicatorSnapshot snapshot, SignalCandidate best) {
        Signal signal = Signal.builder()
                .symbol(symbol)
                .type(best.getType())
                .price(snapshot.getClose())
                .date(snapshot.getDate())
                .confidence(best.getConfidence())
                .strategy(best.getStrategy())
                .indicators(snapshot.definedValues())
                .indicators(best.getIndicators())
                .reason(best.getReason())
                .build();
        log.debug("Signal generated: {}", signal);
        return signal;
    }
}
