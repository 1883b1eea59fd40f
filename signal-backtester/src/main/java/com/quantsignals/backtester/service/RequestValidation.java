package com.quantsignals.backtester.service;

import com.quantsignals.backtester.domain.InvalidConfigurationException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Argument checks shared by the backtest services.
 */
final class RequestValidation {

    private RequestValidation() {
    }

    static String normalizeSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new InvalidConfigurationException("Symbol is required");
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }

    static LocalDate parseDate(String name, String value) {
        if (value == null) {
            throw new InvalidConfigurationException(name + " is required");
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidConfigurationException(name + " must be formatted yyyy-MM-dd, got '" + value + "'", e);
        }
    }

    static void requireOrdered(LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            throw new InvalidConfigurationException("Start and end dates are required");
        }
        if (startDate.isAfter(endDate)) {
            throw new InvalidConfigurationException(
                    String.format("Start date %s is after end date %s", startDate, endDate));
        }
    }

    static BigDecimal positionSize(BigDecimal requested, BigDecimal fallback) {
        BigDecimal fraction = requested != null ? requested : fallback;
        if (fraction == null || fraction.signum() <= 0 || fraction.compareTo(BigDecimal.ONE) > 0) {
            throw new InvalidConfigurationException("Position size fraction must be within (0, 1], got " + fraction);
        }
        return fraction;
    }
}
