package com.quantsignals.backtester.service;

import com.quantsignals.backtester.domain.BacktestResult;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-symbol results of a batch, in request order. Every requested symbol
 * appears either in {@code results} or in {@code failures}.
 */
@Value
public class BatchBacktestResult {
    Map<String, BacktestResult> results;
    List<SymbolFailure> failures;

    public static BatchBacktestResult of(List<SymbolOutcome> outcomes) {
        Map<String, BacktestResult> results = new LinkedHashMap<>();
        List<SymbolFailure> failures = new ArrayList<>();
        for (SymbolOutcome outcome : outcomes) {
            if (outcome.isSuccess()) {
                results.put(outcome.getSymbol(), outcome.getResult());
            } else {
                failures.add(outcome.getFailure());
            }
        }
        return new BatchBacktestResult(Collections.unmodifiableMap(results), Collections.unmodifiableList(failures));
    }

    public int size() {
        return results.size() + failures.size();
    }
}
