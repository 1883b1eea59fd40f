package com.quantsignals.backtester.signal;

import com.quantsignals.backtester.domain.SignalType;
import com.quantsignals.backtester.domain.StrategyKind;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * One strategy's opinion on a bar, before candidates are combined.
 */
@Value
@Builder
public class SignalCandidate {

    SignalType type;
    StrategyKind strategy;
    double confidence;
    @Singular
    Map<String, Double> indicators;
    String reason;
}
