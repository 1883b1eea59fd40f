package com.quantsignals.backtester.service;

import com.quantsignals.backtester.config.TradingProperties;
import com.quantsignals.backtester.domain.Bar;
import com.quantsignals.backtester.domain.Signal;
import com.quantsignals.backtester.signal.SignalGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Produces the current signal for a symbol from its recent history.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SignalService {

    private final BarProvider barProvider;
    private final SignalGenerator signalGenerator;
    private final TradingProperties tradingProperties;
    private final BacktestMetricsService metricsService;
    private final Clock clock;

    /**
     * @return the signal for the latest bar, or empty for Hold
     * @throws com.quantsignals.backtester.domain.DataUnavailableException when no recent bars exist
     */
    public Optional<Signal> generateSignal(String symbol) {
        String ticker = RequestValidation.normalizeSymbol(symbol);
        LocalDate endDate = LocalDate.now(clock);
        LocalDate startDate = endDate.minusDays(tradingProperties.getSignalLookbackDays());

        List<Bar> bars = barProvider.getBars(ticker, startDate, endDate);
        Optional<Signal> signal = signalGenerator.generate(ticker, bars);

        if (signal.isPresent()) {
            metricsService.recordSignalsGenerated(1);
            log.info("Signal for {}: {}", ticker, signal.get());
        } else {
            log.info("Signal for {}: HOLD ({} bars)", ticker, bars.size());
        }
        return signal;
    }
}
