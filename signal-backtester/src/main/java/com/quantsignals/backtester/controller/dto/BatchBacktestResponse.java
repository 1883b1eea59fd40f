package com.quantsignals.backtester.controller.dto;

import com.quantsignals.backtester.service.BatchBacktestResult;
import com.quantsignals.backtester.service.SymbolFailure;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a multi-symbol backtest.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BatchBacktestResponse {

    private int succeeded;
    private int failed;
    private Map<String, BacktestResponse> results;
    private List<SymbolFailure> failures;

    public static BatchBacktestResponse from(BatchBacktestResult batch) {
        Map<String, BacktestResponse> results = new LinkedHashMap<>();
        batch.getResults().forEach((symbol, result) -> results.put(symbol, BacktestResponse.from(result)));

        return BatchBacktestResponse.builder()
                .succeeded(results.size())
                .failed(batch.getFailures().size())
                .results(results)
                .failures(batch.getFailures())
                .build();
    }
}
