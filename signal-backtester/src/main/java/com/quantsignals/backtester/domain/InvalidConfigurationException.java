package com.quantsignals.backtester.domain;

/**
 * Raised when a strategy, indicator or backtest parameter is out of range.
 * Always fatal for the call that supplied it.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
