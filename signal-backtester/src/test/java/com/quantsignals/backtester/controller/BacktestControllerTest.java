package com.quantsignals.backtester.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantsignals.backtester.controller.dto.BacktestRequest;
import com.quantsignals.backtester.controller.dto.BatchBacktestRequest;
import com.quantsignals.backtester.domain.BacktestAbortedException;
import com.quantsignals.backtester.domain.BacktestResult;
import com.quantsignals.backtester.domain.DataUnavailableException;
import com.quantsignals.backtester.domain.InvalidConfigurationException;
import com.quantsignals.backtester.domain.PerformanceMetrics;
import com.quantsignals.backtester.domain.Signal;
import com.quantsignals.backtester.domain.SignalType;
import com.quantsignals.backtester.domain.StrategyKind;
import com.quantsignals.backtester.service.BacktestService;
import com.quantsignals.backtester.service.BatchBacktestResult;
import com.quantsignals.backtester.service.BatchBacktestService;
import com.quantsignals.backtester.service.SignalService;
import com.quantsignals.backtester.service.SymbolFailure;
import com.quantsignals.backtester.service.SymbolOutcome;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration tests for the backtest and signal REST endpoints.
 */
@WebMvcTest({BacktestController.class, SignalController.class})
class BacktestControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private BacktestService backtestService;

    @MockBean
    private BatchBacktestService batchBacktestService;

    @MockBean
    private SignalService signalService;

    @Test
    void testRunBacktest_Success() throws Exception {
        // Arrange
        when(backtestService.runBacktest(eq("AAPL"), eq("2024-01-01"), eq("2024-06-30"), any()))
                .thenReturn(createResult("AAPL"));

        // Act & Assert
        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(createValidRequest())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.symbol").value("AAPL"))
                .andExpect(jsonPath("$.finalCapital").value(109890))
                .andExpect(jsonPath("$.metrics.totalTrades").value(1))
                .andExpect(jsonPath("$.trades").isArray());
    }

    @Test
    void testRunBacktest_NoDataReturns404() throws Exception {
        when(backtestService.runBacktest(anyString(), anyString(), anyString(), any()))
                .thenThrow(new DataUnavailableException("AAPL", "No data for AAPL"));

        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(createValidRequest())))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("No data for AAPL"))
                .andExpect(jsonPath("$.symbol").value("AAPL"));
    }

    @Test
    void testRunBacktest_InvalidConfigurationReturns400() throws Exception {
        when(backtestService.runBacktest(anyString(), anyString(), anyString(), any()))
                .thenThrow(new InvalidConfigurationException("Start date 2024-06-30 is after end date 2024-01-01"));

        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(createValidRequest())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void testRunBacktest_AbortedReturns503() throws Exception {
        when(backtestService.runBacktest(anyString(), anyString(), anyString(), any()))
                .thenThrow(new BacktestAbortedException("Backtest aborted"));

        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(createValidRequest())))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void testRunBacktest_MissingSymbolReturns400() throws Exception {
        // Arrange
        BacktestRequest request = createValidRequest();
        request.setSymbol("");

        // Act & Assert
        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation failed"))
                .andExpect(jsonPath("$.fields.symbol").value("Symbol is required"));

        verifyNoInteractions(backtestService);
    }

    @Test
    void testRunBacktest_MalformedBodyReturns400() throws Exception {
        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"symbol\": \"AAPL\", \"startDate\": \"not-a-date\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request body"));
    }

    @Test
    void testRunBatch_ReportsSuccessesAndFailures() throws Exception {
        // Arrange
        BatchBacktestRequest request = BatchBacktestRequest.builder()
                .symbols(List.of("AAPL", "NODATA"))
                .startDate(LocalDate.of(2024, 1, 1))
                .endDate(LocalDate.of(2024, 6, 30))
                .build();
        BatchBacktestResult batch = BatchBacktestResult.of(List.of(
                SymbolOutcome.success("AAPL", createResult("AAPL")),
                SymbolOutcome.failure(SymbolFailure.of("NODATA",
                        new DataUnavailableException("NODATA", "No data for NODATA"), 1))));
        when(batchBacktestService.runMultipleSymbolBacktest(anyList(), eq("2024-01-01"), eq("2024-06-30"), any()))
                .thenReturn(batch);

        // Act & Assert
        mockMvc.perform(post("/backtests/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.succeeded").value(1))
                .andExpect(jsonPath("$.failed").value(1))
                .andExpect(jsonPath("$.results.AAPL.symbol").value("AAPL"))
                .andExpect(jsonPath("$.failures[0].symbol").value("NODATA"))
                .andExpect(jsonPath("$.failures[0].errorType").value("DataUnavailableException"));
    }

    @Test
    void testRunBatch_EmptySymbolsReturns400() throws Exception {
        BatchBacktestRequest request = BatchBacktestRequest.builder()
                .symbols(List.of())
                .startDate(LocalDate.of(2024, 1, 1))
                .endDate(LocalDate.of(2024, 6, 30))
                .build();

        mockMvc.perform(post("/backtests/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fields.symbols").exists());

        verifyNoInteractions(batchBacktestService);
    }

    @Test
    void testGetSignal_HoldWhenNoSignal() throws Exception {
        when(signalService.generateSignal("aapl")).thenReturn(Optional.empty());

        mockMvc.perform(get("/signals/aapl"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.symbol").value("AAPL"))
                .andExpect(jsonPath("$.action").value("HOLD"))
                .andExpect(jsonPath("$.price").doesNotExist());
    }

    @Test
    void testGetSignal_Buy() throws Exception {
        // Arrange
        Signal signal = Signal.builder()
                .symbol("AAPL")
                .type(SignalType.BUY)
                .price(new BigDecimal("93.0"))
                .date(LocalDate.of(2024, 2, 21))
                .confidence(0.8)
                .strategy(StrategyKind.MA_CROSS)
                .indicator("sma_short", 72.0)
                .indicator("sma_long", 71.5)
                .reason("Golden cross")
                .build();
        when(signalService.generateSignal("AAPL")).thenReturn(Optional.of(signal));

        // Act & Assert
        mockMvc.perform(get("/signals/AAPL"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("BUY"))
                .andExpect(jsonPath("$.strategy").value("MA_CROSS"))
                .andExpect(jsonPath("$.confidence").value(0.8))
                .andExpect(jsonPath("$.date").value("2024-02-21"))
                .andExpect(jsonPath("$.indicators.sma_short").value(72.0));
    }

    @Test
    void testGetSignal_NoDataReturns404() throws Exception {
        when(signalService.generateSignal("ZZZZ"))
                .thenThrow(new DataUnavailableException("ZZZZ", "No data for ZZZZ"));

        mockMvc.perform(get("/signals/ZZZZ"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.symbol").value("ZZZZ"));
    }

    private BacktestRequest createValidRequest() {
        return BacktestRequest.builder()
                .symbol("AAPL")
                .startDate(LocalDate.of(2024, 1, 1))
                .endDate(LocalDate.of(2024, 6, 30))
                .positionSizeFraction(new BigDecimal("0.1"))
                .build();
    }

    private static BacktestResult createResult(String symbol) {
        return BacktestResult.builder()
                .symbol(symbol)
                .initialCapital(new BigDecimal("100000"))
                .finalCapital(new BigDecimal("109890"))
                .equityCurve(List.of())
                .trades(List.of())
                .metrics(PerformanceMetrics.builder()
                        .totalReturn(new BigDecimal("9890"))
                        .totalReturnPct(new BigDecimal("9.8900"))
                        .totalTrades(1)
                        .profitableTrades(1)
                        .build())
                .build();
    }
}
