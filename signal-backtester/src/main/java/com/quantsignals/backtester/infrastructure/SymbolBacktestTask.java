package com.quantsignals.backtester.infrastructure;

import com.quantsignals.backtester.domain.BacktestAbortedException;
import com.quantsignals.backtester.domain.BacktestResult;
import com.quantsignals.backtester.domain.DataUnavailableException;
import com.quantsignals.backtester.service.BacktestMetricsService;
import com.quantsignals.backtester.service.BacktestService;
import com.quantsignals.backtester.service.SymbolFailure;
import com.quantsignals.backtester.service.SymbolOutcome;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.concurrent.Callable;
import java.util.function.BooleanSupplier;

/**
 * One symbol of a batch, run on a pool thread.
 * Each attempt has its own deadline, checked at bar boundaries. Retryable
 * data failures are retried after a fixed backoff; everything else fails the
 * symbol immediately. Never throws: the outcome carries the failure instead.
 * <p>
 * The bar fetch happens before the first bar boundary, so a fetch that hangs
 * is not covered by the attempt deadline. It is bounded only by the
 * per-symbol wait in {@link com.quantsignals.backtester.service.BatchRun},
 * which interrupts the task when that wait runs out.
 */
@Slf4j
@Builder
public class SymbolBacktestTask implements Callable<SymbolOutcome> {

    private final BacktestService backtestService;
    private final BacktestMetricsService metricsService;
    private final String symbol;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final BigDecimal positionSizeFraction;
    private final Duration attemptTimeout;
    private final int maxRetries;
    private final Duration retryBackoff;
    private final BooleanSupplier cancelled;

    @Override
    public SymbolOutcome call() {
        MDC.put("symbol", symbol);
        MDC.put("worker", Thread.currentThread().getName());

        int attempt = 0;
        try {
            while (true) {
                if (cancelled.getAsBoolean()) {
                    log.info("Batch cancelled before attempt {}", attempt + 1);
                    return fail(new BacktestAbortedException("Batch cancelled"), attempt);
                }
                attempt++;

                long deadline = System.nanoTime() + attemptTimeout.toNanos();
                BooleanSupplier abortSignal = () -> cancelled.getAsBoolean() || System.nanoTime() - deadline > 0;

                try {
                    BacktestResult result = backtestService.runBacktest(
                            symbol, startDate, endDate, positionSizeFraction, abortSignal);
                    log.info("Completed on attempt {}", attempt);
                    return SymbolOutcome.success(symbol, result);
                } catch (DataUnavailableException e) {
                    if (!e.isRetryable() || attempt > maxRetries) {
                        log.warn("Failed permanently after {} attempt(s): {}", attempt, e.getMessage());
                        return fail(e, attempt);
                    }
                    log.warn("Attempt {}/{} failed: {}. Retrying in {}ms",
                            attempt, maxRetries + 1, e.getMessage(), retryBackoff.toMillis());
                    metricsService.recordRunRetried();
                    Thread.sleep(retryBackoff.toMillis());
                } catch (RuntimeException e) {
                    log.error("Failed on attempt {}: {}", attempt, e.getMessage(), e);
                    return fail(e, attempt);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted during retry backoff");
            return fail(new BacktestAbortedException("Interrupted during retry backoff"), attempt);
        } finally {
            MDC.remove("symbol");
            MDC.remove("worker");
        }
    }

    private SymbolOutcome fail(Throwable error, int attempts) {
        return SymbolOutcome.failure(SymbolFailure.of(symbol, error, attempts));
    }
}
