package com.quantsignals.backtester.signal;

import com.quantsignals.backtester.domain.StrategyKind;

import java.util.Optional;

/**
 * A single-indicator trading rule evaluated against an {@link IndicatorSnapshot}.
 */
public interface Strategy {

    /**
     * Evaluate the rule on the given snapshot.
     *
     * @param snapshot indicator values at the current and previous bar
     * @return a candidate, or empty when the rule does not trigger
     * @throws com.quantsignals.backtester.indicator.InsufficientDataException
     *         when an input indicator is still warming up
     */
    Optional<SignalCandidate> evaluate(IndicatorSnapshot snapshot);

    StrategyKind getKind();

    /**
     * Get the strategy name.
     */
    String getName();
}
