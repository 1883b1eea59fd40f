package com.quantsignals.backtester.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Core backtesting engine: replays bars one at a time through a signal source
 * and a {@link PositionLedger}.
 */
@Slf4j
public class BacktestEngine {

    /**
     * Run a backtest with the given parameters.
     *
     * @throws BacktestAbortedException when the abort signal fires at a bar boundary
     */
    public BacktestResult runBacktest(BacktestConfig config) {
        config.validate();
        String symbol = config.getSymbol();
        log.info("Starting backtest - Symbol: {}, Bars: {}, Position size: {}",
                symbol, config.getBars().size(), config.getPositionSizeFraction());

        PositionLedger ledger = new PositionLedger(config.getInitialCapital(), config.getCommissionRate());
        List<EquityPoint> equityCurve = new ArrayList<>();
        Bar lastAccepted = null;
        int skippedBars = 0;
        int signalsGenerated = 0;

        for (Bar bar : config.getBars()) {
            if (config.getAbortSignal().getAsBoolean()) {
                throw new BacktestAbortedException("Backtest for " + symbol + " aborted after "
                        + equityCurve.size() + " bars");
            }

            boolean newDate = bar.getDate() != null && (equityCurve.isEmpty()
                    || bar.getDate().isAfter(equityCurve.get(equityCurve.size() - 1).getDate()));
            if (!bar.isComplete() || !newDate) {
                log.debug("Skipping bar for {}: {}", symbol, bar);
                skippedBars++;
                if (newDate) {
                    // value carried forward from the previous point
                    BigDecimal carried = equityCurve.isEmpty()
                            ? config.getInitialCapital()
                            : equityCurve.get(equityCurve.size() - 1).getValue();
                    equityCurve.add(new EquityPoint(bar.getDate(), carried));
                }
                continue;
            }
            lastAccepted = bar;

            Optional<Signal> signal = config.getSignalSource().onBar(bar);
            if (signal.isPresent()) {
                signalsGenerated++;
                execute(signal.get(), bar, ledger, config);
            }

            equityCurve.add(new EquityPoint(bar.getDate(), ledger.getPortfolioValue(symbol, bar.getClose())));
        }

        if (lastAccepted != null) {
            ledger.forceClose(symbol, lastAccepted.getClose(), lastAccepted.getDate());
        }

        BacktestResult result = BacktestResult.builder()
                .symbol(symbol)
                .initialCapital(config.getInitialCapital())
                .finalCapital(ledger.getCash())
                .equityCurve(List.copyOf(equityCurve))
                .trades(List.copyOf(ledger.getTradeLog()))
                .skippedBars(skippedBars)
                .signalsGenerated(signalsGenerated)
                .build();

        PerformanceMetrics metrics = MetricsCalculator.calculate(result);

        log.info("Backtest completed - Symbol: {}, Final capital: {}, Total Return: {}%, Sharpe: {}, "
                        + "Max DD: {}%, Win Rate: {}%, Trades: {}, Skipped bars: {}",
                symbol, result.getFinalCapital(), metrics.getTotalReturnPct(), metrics.getSharpeRatio(),
                metrics.getMaxDrawdown(), metrics.getWinRate(), metrics.getTotalTrades(), skippedBars);

        return result.toBuilder().metrics(metrics).build();
    }

    private void execute(Signal signal, Bar bar, PositionLedger ledger, BacktestConfig config) {
        String symbol = config.getSymbol();
        switch (signal.getType()) {
            case BUY -> ledger.buy(symbol, bar.getClose(), bar.getDate(), config.getPositionSizeFraction());
            case SELL -> ledger.sell(symbol, bar.getClose(), bar.getDate());
        }
    }

    /**
     * Configuration for a backtest run.
     */
    @Value
    @Builder
    public static class BacktestConfig {
        String symbol;
        List<Bar> bars;
        SignalSource signalSource;
        BigDecimal initialCapital;
        BigDecimal positionSizeFraction;
        @Builder.Default
        BigDecimal commissionRate = new BigDecimal("0.001");
        /** Polled at every bar boundary; true aborts the run. */
        @Builder.Default
        BooleanSupplier abortSignal = () -> false;

        void validate() {
            if (symbol == null || symbol.isBlank()) {
                throw new InvalidConfigurationException("Symbol is required");
            }
            if (bars == null || signalSource == null) {
                throw new InvalidConfigurationException("Bars and signal source are required");
            }
            if (initialCapital == null || initialCapital.signum() < 0) {
                throw new InvalidConfigurationException("Initial capital must not be negative, got " + initialCapital);
            }
            PositionLedger.requireFraction(positionSizeFraction);
        }
    }
}
