package com.quantsignals.backtester.controller;

import com.quantsignals.backtester.controller.dto.BacktestRequest;
import com.quantsignals.backtester.controller.dto.BacktestResponse;
import com.quantsignals.backtester.controller.dto.BatchBacktestRequest;
import com.quantsignals.backtester.controller.dto.BatchBacktestResponse;
import com.quantsignals.backtester.domain.BacktestResult;
import com.quantsignals.backtester.service.BacktestService;
import com.quantsignals.backtester.service.BatchBacktestResult;
import com.quantsignals.backtester.service.BatchBacktestService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for backtest operations.
 */
@RestController
@RequestMapping("/backtests")
@RequiredArgsConstructor
@Slf4j
public class BacktestController {

    private final BacktestService backtestService;
    private final BatchBacktestService batchBacktestService;

    /**
     * Run a backtest for one symbol.
     *
     * @param request the backtest request
     * @return the result with trades, equity curve and metrics
     */
    @PostMapping
    public ResponseEntity<BacktestResponse> runBacktest(@Valid @RequestBody BacktestRequest request) {

        log.info("POST /backtests - Symbol: {}, Period: {} to {}",
                request.getSymbol(), request.getStartDate(), request.getEndDate());

        BacktestResult result = backtestService.runBacktest(request.getSymbol(),
                request.getStartDate().toString(), request.getEndDate().toString(),
                request.getPositionSizeFraction());

        return ResponseEntity.ok(BacktestResponse.from(result));
    }

    /**
     * Run a backtest for several symbols. Per-symbol failures are reported in
     * the body; the request itself still succeeds.
     */
    @PostMapping("/batch")
    public ResponseEntity<BatchBacktestResponse> runBatch(@Valid @RequestBody BatchBacktestRequest request) {

        log.info("POST /backtests/batch - Symbols: {}, Period: {} to {}",
                request.getSymbols(), request.getStartDate(), request.getEndDate());

        BatchBacktestResult result = batchBacktestService.runMultipleSymbolBacktest(request.getSymbols(),
                request.getStartDate().toString(), request.getEndDate().toString(),
                request.getPositionSizeFraction());

        return ResponseEntity.ok(BatchBacktestResponse.from(result));
    }
}
