package com.quantsignals.backtester.service;

import com.quantsignals.backtester.domain.BacktestResult;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.function.BooleanSupplier;

/**
 * Service interface for single-symbol backtests.
 */
public interface BacktestService {

    /**
     * Run a backtest over an inclusive date range.
     *
     * @param symbol               the ticker to backtest
     * @param startDate            first day, formatted {@code yyyy-MM-dd}
     * @param endDate              last day, formatted {@code yyyy-MM-dd}
     * @param positionSizeFraction fraction of cash committed per entry, or null for the configured default
     * @return the completed result with metrics
     * @throws com.quantsignals.backtester.domain.DataUnavailableException      when the symbol has no data in range
     * @throws com.quantsignals.backtester.domain.InvalidConfigurationException for bad dates or fraction
     */
    BacktestResult runBacktest(String symbol, String startDate, String endDate, BigDecimal positionSizeFraction);

    /**
     * Run a backtest that can be aborted at any bar boundary.
     *
     * @param abortSignal polled before each bar; returning true aborts the run
     * @throws com.quantsignals.backtester.domain.BacktestAbortedException when aborted
     */
    BacktestResult runBacktest(String symbol, LocalDate startDate, LocalDate endDate,
                               BigDecimal positionSizeFraction, BooleanSupplier abortSignal);
}
