package com.quantsignals.backtester.indicator;

/**
 * Thrown when an indicator value is requested inside its warm-up window.
 * Recoverable: the caller is expected to abstain rather than fail.
 */
public class InsufficientDataException extends RuntimeException {

    public InsufficientDataException(String message) {
        super(message);
    }
}
