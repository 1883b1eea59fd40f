package com.quantsignals.backtester.service;

import com.quantsignals.backtester.domain.Bar;
import com.quantsignals.backtester.domain.DataUnavailableException;
import com.quantsignals.backtester.domain.HistoricalBar;
import com.quantsignals.backtester.repository.HistoricalBarRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * Unit tests for MarketDataService.
 */
@ExtendWith(MockitoExtension.class)
class MarketDataServiceTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);
    private static final LocalDate END = LocalDate.of(2024, 1, 31);

    @Mock
    private HistoricalBarRepository historicalBarRepository;

    @InjectMocks
    private MarketDataService marketDataService;

    @Test
    void testGetBars_MapsStoredRowsInOrder() {
        // Arrange
        when(historicalBarRepository.findBySymbolAndDateRange("AAPL", START, END)).thenReturn(List.of(
                row(LocalDate.of(2024, 1, 2), "185.6400"),
                row(LocalDate.of(2024, 1, 3), "184.2500")));

        // Act
        List<Bar> bars = marketDataService.getBars("AAPL", START, END);

        // Assert
        assertEquals(2, bars.size());
        assertEquals(LocalDate.of(2024, 1, 2), bars.get(0).getDate());
        assertEquals(new BigDecimal("184.2500"), bars.get(1).getClose());
        assertEquals("AAPL", bars.get(1).getSymbol());
        assertTrue(bars.get(0).isComplete());
    }

    @Test
    void testGetBars_EmptyRangeIsNotRetryable() {
        when(historicalBarRepository.findBySymbolAndDateRange("AAPL", START, END)).thenReturn(List.of());

        DataUnavailableException error = assertThrows(DataUnavailableException.class,
                () -> marketDataService.getBars("AAPL", START, END));
        assertFalse(error.isRetryable());
        assertEquals("AAPL", error.getSymbol());
    }

    @Test
    void testGetBars_DatabaseFailureIsRetryable() {
        when(historicalBarRepository.findBySymbolAndDateRange("AAPL", START, END))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        DataUnavailableException error = assertThrows(DataUnavailableException.class,
                () -> marketDataService.getBars("AAPL", START, END));
        assertTrue(error.isRetryable());
        assertInstanceOf(DataAccessResourceFailureException.class, error.getCause());
    }

    private static HistoricalBar row(LocalDate date, String close) {
        BigDecimal price = new BigDecimal(close);
        return HistoricalBar.builder()
                .symbol("AAPL")
                .date(date)
                .open(price)
                .high(price.add(BigDecimal.ONE))
                .low(price.subtract(BigDecimal.ONE))
                .close(price)
                .volume(50_000_000L)
                .build();
    }
}
