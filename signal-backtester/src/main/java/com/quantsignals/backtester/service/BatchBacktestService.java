package com.quantsignals.backtester.service;

import com.quantsignals.backtester.config.TradingProperties;
import com.quantsignals.backtester.domain.InvalidConfigurationException;
import com.quantsignals.backtester.infrastructure.SymbolBacktestTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fans a multi-symbol backtest out over the bounded worker pool.
 * One symbol's failure never affects the others.
 */
@Service
@Slf4j
public class BatchBacktestService {

    private final BacktestService backtestService;
    private final ExecutorService executorService;
    private final TradingProperties tradingProperties;
    private final BacktestMetricsService metricsService;

    public BatchBacktestService(BacktestService backtestService,
                                @Qualifier("batchExecutorService") ExecutorService executorService,
                                TradingProperties tradingProperties,
                                BacktestMetricsService metricsService) {
        this.backtestService = backtestService;
        this.executorService = executorService;
        this.tradingProperties = tradingProperties;
        this.metricsService = metricsService;
    }

    /**
     * Run every symbol and wait for all of them.
     *
     * @throws InvalidConfigurationException for bad dates, fraction or an empty symbol list
     */
    public BatchBacktestResult runMultipleSymbolBacktest(List<String> symbols, String startDate, String endDate,
                                                         BigDecimal positionSizeFraction) {
        return submit(symbols, startDate, endDate, positionSizeFraction).await();
    }

    /**
     * Submit one task per distinct symbol and return immediately.
     */
    public BatchRun submit(List<String> symbols, String startDate, String endDate, BigDecimal positionSizeFraction) {
        LocalDate start = RequestValidation.parseDate("startDate", startDate);
        LocalDate end = RequestValidation.parseDate("endDate", endDate);
        RequestValidation.requireOrdered(start, end);
        BigDecimal fraction = RequestValidation.positionSize(positionSizeFraction,
                tradingProperties.getDefaultPositionSize());

        if (symbols == null || symbols.isEmpty()) {
            throw new InvalidConfigurationException("At least one symbol is required");
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String symbol : symbols) {
            distinct.add(RequestValidation.normalizeSymbol(symbol));
        }

        TradingProperties.Batch batch = tradingProperties.getBatch();
        AtomicBoolean cancelled = new AtomicBoolean(false);
        Map<String, Future<SymbolOutcome>> futures = new LinkedHashMap<>();

        for (String symbol : distinct) {
            SymbolBacktestTask task = SymbolBacktestTask.builder()
                    .backtestService(backtestService)
                    .metricsService(metricsService)
                    .symbol(symbol)
                    .startDate(start)
                    .endDate(end)
                    .positionSizeFraction(fraction)
                    .attemptTimeout(batch.getSymbolTimeout())
                    .maxRetries(batch.getMaxRetries())
                    .retryBackoff(batch.getRetryBackoff())
                    .cancelled(cancelled::get)
                    .build();
            futures.put(symbol, executorService.submit(task));
        }

        log.info("Submitted batch of {} symbols from {} to {}", futures.size(), start, end);
        return new BatchRun(futures, cancelled, symbolBudget(batch));
    }

    /**
     * Longest a symbol can take: every attempt timing out plus every backoff, with one second of slack.
     */
    private static Duration symbolBudget(TradingProperties.Batch batch) {
        int attempts = batch.getMaxRetries() + 1;
        return batch.getSymbolTimeout().multipliedBy(attempts)
                .plus(batch.getRetryBackoff().multipliedBy(batch.getMaxRetries()))
                .plusSeconds(1);
    }
}
