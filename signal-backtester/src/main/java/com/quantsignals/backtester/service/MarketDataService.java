package com.quantsignals.backtester.service;

import com.quantsignals.backtester.domain.Bar;
import com.quantsignals.backtester.domain.DataUnavailableException;
import com.quantsignals.backtester.domain.HistoricalBar;
import com.quantsignals.backtester.repository.HistoricalBarRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Loads daily bars from PostgreSQL with Redis caching.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketDataService implements BarProvider {

    private final HistoricalBarRepository historicalBarRepository;

    /**
     * Load bars for the given symbol and date range.
     * Uses the Redis "bars" cache (TTL: 10 minutes) to avoid repeated database queries.
     */
    @Override
    @Cacheable(value = "bars", key = "#symbol + '_' + #startDate + '_' + #endDate")
    public List<Bar> getBars(String symbol, LocalDate startDate, LocalDate endDate) {
        log.info("Loading bars for {} from {} to {}", symbol, startDate, endDate);

        List<HistoricalBar> rows;
        try {
            rows = historicalBarRepository.findBySymbolAndDateRange(symbol, startDate, endDate);
        } catch (DataAccessException e) {
            throw new DataUnavailableException(symbol,
                    "Failed to read bars for " + symbol + ": " + e.getMessage(), true, e);
        }

        if (rows.isEmpty()) {
            throw new DataUnavailableException(symbol,
                    String.format("No data for %s between %s and %s", symbol, startDate, endDate));
        }

        log.info("Loaded {} bars for {} from database", rows.size(), symbol);
        return rows.stream()
                .map(HistoricalBar::toBar)
                .collect(Collectors.toList());
    }
}
