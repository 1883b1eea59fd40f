package com.quantsignals.backtester.domain;

import java.util.Optional;

/**
 * Supplies the signal for each accepted bar of a single backtest run.
 * Implementations may keep state across calls but must only look at bars
 * they have already been given.
 */
@FunctionalInterface
public interface SignalSource {

    /**
     * @param bar the current, complete bar
     * @return the signal for this bar, or empty for Hold
     */
    Optional<Signal> onBar(Bar bar);
}
