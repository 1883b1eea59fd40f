package com.quantsignals.backtester.service;

import lombok.Value;

/**
 * Why one symbol of a batch produced no result.
 */
@Value
public class SymbolFailure {
    String symbol;
    String errorType;
    String message;
    int attempts;

    public static SymbolFailure of(String symbol, Throwable error, int attempts) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new SymbolFailure(symbol, error.getClass().getSimpleName(), message, attempts);
    }
}
