package com.quantsignals.backtester.service;

import com.quantsignals.backtester.domain.BacktestResult;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result or failure of one symbol in a batch; exactly one side is set.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SymbolOutcome {
    String symbol;
    BacktestResult result;
    SymbolFailure failure;

    public static SymbolOutcome success(String symbol, BacktestResult result) {
        return new SymbolOutcome(symbol, result, null);
    }

    public static SymbolOutcome failure(SymbolFailure failure) {
        return new SymbolOutcome(failure.getSymbol(), null, failure);
    }

    public boolean isSuccess() {
        return result != null;
    }
}
