package com.quantsignals.backtester.domain;

import lombok.Getter;

/**
 * Raised when the bar provider cannot supply data for a symbol.
 * Retryable failures are transient (connection loss, timeouts); an empty date
 * range is not.
 */
@Getter
public class DataUnavailableException extends RuntimeException {

    private final String symbol;
    private final boolean retryable;

    public DataUnavailableException(String symbol, String message) {
        this(symbol, message, false, null);
    }

    public DataUnavailableException(String symbol, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.symbol = symbol;
        this.retryable = retryable;
    }
}
