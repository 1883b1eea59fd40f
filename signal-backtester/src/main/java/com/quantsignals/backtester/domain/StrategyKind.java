package com.quantsignals.backtester.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Indicator strategies that can contribute a signal candidate.
 * Higher priority wins when two candidates have the same confidence.
 */
@Getter
@RequiredArgsConstructor
public enum StrategyKind {
    MA_CROSS("Moving average crossover", 4),
    MACD("MACD crossover", 3),
    RSI("RSI threshold", 2),
    BOLLINGER("Bollinger band touch", 1);

    private final String label;
    private final int priority;
}
