package com.quantsignals.backtester.domain;

/**
 * Raised at a bar boundary when a running backtest is cancelled or exceeds its
 * time budget. The partially built ledger is discarded.
 */
public class BacktestAbortedException extends RuntimeException {

    public BacktestAbortedException(String message) {
        super(message);
    }
}
