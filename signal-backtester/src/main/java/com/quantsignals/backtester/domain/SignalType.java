package com.quantsignals.backtester.domain;

/**
 * Direction of an emitted signal. Hold is the absence of a signal.
 */
public enum SignalType {
    BUY,
    SELL
}
