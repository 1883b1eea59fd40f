package com.quantsignals.backtester.service;

import com.quantsignals.backtester.domain.BacktestAbortedException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on a submitted batch. {@link #await()} blocks until every symbol has
 * an outcome; {@link #cancel()} stops tasks that have not started and makes
 * running ones abort at their next bar boundary.
 */
@Slf4j
public class BatchRun {

    private final Map<String, Future<SymbolOutcome>> futures;
    private final AtomicBoolean cancelled;
    private final Duration symbolBudget;

    BatchRun(Map<String, Future<SymbolOutcome>> futures, AtomicBoolean cancelled, Duration symbolBudget) {
        this.futures = futures;
        this.cancelled = cancelled;
        this.symbolBudget = symbolBudget;
    }

    public List<String> getSymbols() {
        return List.copyOf(futures.keySet());
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Cancelling batch of {} symbols", futures.size());
            futures.values().forEach(future -> future.cancel(false));
        }
    }

    /**
     * Wait for every symbol and merge the outcomes in submission order.
     */
    public BatchBacktestResult await() {
        List<SymbolOutcome> outcomes = new ArrayList<>(futures.size());
        futures.forEach((symbol, future) -> outcomes.add(collect(symbol, future)));

        BatchBacktestResult result = BatchBacktestResult.of(outcomes);
        log.info("Batch finished: {} succeeded, {} failed", result.getResults().size(), result.getFailures().size());
        return result;
    }

    private SymbolOutcome collect(String symbol, Future<SymbolOutcome> future) {
        try {
            return future.get(symbolBudget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (CancellationException e) {
            return failed(symbol, new BacktestAbortedException("Batch cancelled"));
        } catch (TimeoutException e) {
            future.cancel(true);
            return failed(symbol, new BacktestAbortedException("No outcome within " + symbolBudget));
        } catch (ExecutionException e) {
            log.error("Task for {} failed unexpectedly", symbol, e.getCause());
            return failed(symbol, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return failed(symbol, new BacktestAbortedException("Interrupted while waiting for batch"));
        }
    }

    private static SymbolOutcome failed(String symbol, Throwable error) {
        return SymbolOutcome.failure(SymbolFailure.of(symbol, error, 0));
    }
}
