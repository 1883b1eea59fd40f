package com.quantsignals.backtester.service;

import com.quantsignals.backtester.config.TradingProperties;
import com.quantsignals.backtester.domain.BacktestEngine;
import com.quantsignals.backtester.domain.BacktestResult;
import com.quantsignals.backtester.domain.Bar;
import com.quantsignals.backtester.signal.SignalGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Fetches bars and replays them through a fresh signal session and ledger.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BacktestServiceImpl implements BacktestService {

    private final BarProvider barProvider;
    private final SignalGenerator signalGenerator;
    private final TradingProperties tradingProperties;
    private final BacktestMetricsService metricsService;

    @Override
    public BacktestResult runBacktest(String symbol, String startDate, String endDate, BigDecimal positionSizeFraction) {
        return runBacktest(symbol,
                RequestValidation.parseDate("startDate", startDate),
                RequestValidation.parseDate("endDate", endDate),
                positionSizeFraction,
                () -> false);
    }

    @Override
    public BacktestResult runBacktest(String symbol, LocalDate startDate, LocalDate endDate,
                                      BigDecimal positionSizeFraction, BooleanSupplier abortSignal) {
        String ticker = RequestValidation.normalizeSymbol(symbol);
        RequestValidation.requireOrdered(startDate, endDate);
        BigDecimal fraction = RequestValidation.positionSize(positionSizeFraction,
                tradingProperties.getDefaultPositionSize());

        long startTime = System.currentTimeMillis();
        try {
            List<Bar> bars = barProvider.getBars(ticker, startDate, endDate);

            BacktestEngine.BacktestConfig config = BacktestEngine.BacktestConfig.builder()
                    .symbol(ticker)
                    .bars(bars)
                    .signalSource(signalGenerator.openSession(ticker))
                    .initialCapital(tradingProperties.getInitialCapital())
                    .positionSizeFraction(fraction)
                    .commissionRate(tradingProperties.getCommissionRate())
                    .abortSignal(abortSignal)
                    .build();

            BacktestResult result = new BacktestEngine().runBacktest(config);

            long executionTimeMs = System.currentTimeMillis() - startTime;
            metricsService.recordRunCompleted(executionTimeMs);
            metricsService.recordSignalsGenerated(result.getSignalsGenerated());
            log.info("Backtest for {} from {} to {} completed in {}ms", ticker, startDate, endDate, executionTimeMs);
            return result;
        } catch (RuntimeException e) {
            metricsService.recordRunFailed();
            log.warn("Backtest for {} failed: {}", ticker, e.getMessage());
            throw e;
        }
    }
}
