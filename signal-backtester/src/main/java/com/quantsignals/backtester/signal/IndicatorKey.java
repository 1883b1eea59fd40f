package com.quantsignals.backtester.signal;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Indicator values tracked per symbol. The key name is what appears in a
 * signal's contributing-indicator map.
 */
@Getter
@RequiredArgsConstructor
public enum IndicatorKey {
    RSI("rsi"),
    MACD("macd"),
    MACD_SIGNAL("macd_signal"),
    MACD_HISTOGRAM("macd_histogram"),
    BB_UPPER("bb_upper"),
    BB_MIDDLE("bb_middle"),
    BB_LOWER("bb_lower"),
    SMA_SHORT("sma_short"),
    SMA_LONG("sma_long"),
    EMA_SHORT("ema_short"),
    EMA_LONG("ema_long"),
    STOCH_K("stoch_k"),
    STOCH_D("stoch_d"),
    WILLIAMS_R("williams_r"),
    ATR("atr");

    private final String key;
}
