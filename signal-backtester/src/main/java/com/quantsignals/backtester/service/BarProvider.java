package com.quantsignals.backtester.service;

import com.quantsignals.backtester.domain.Bar;
import com.quantsignals.backtester.domain.DataUnavailableException;

import java.time.LocalDate;
import java.util.List;

/**
 * Source of daily bars for a symbol.
 */
public interface BarProvider {

    /**
     * @return bars in ascending date order, never empty
     * @throws DataUnavailableException when the range holds no data or the store cannot be read
     */
    List<Bar> getBars(String symbol, LocalDate startDate, LocalDate endDate);
}
