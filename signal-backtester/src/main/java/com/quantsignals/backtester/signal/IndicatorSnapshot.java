package com.quantsignals.backtester.signal;

import com.quantsignals.backtester.indicator.InsufficientDataException;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Indicator values at one bar together with the values at the bar before it.
 * Reading an undefined value raises {@link InsufficientDataException}.
 */
@Getter
public final class IndicatorSnapshot {

    private final LocalDate date;
    private final BigDecimal close;
    private final int barCount;
    private final Map<IndicatorKey, Double> currentValues;
    private final Map<IndicatorKey, Double> previousValues;

    IndicatorSnapshot(LocalDate date, BigDecimal close, int barCount,
                      EnumMap<IndicatorKey, Double> currentValues,
                      EnumMap<IndicatorKey, Double> previousValues) {
        this.date = date;
        this.close = close;
        this.barCount = barCount;
        this.currentValues = Collections.unmodifiableMap(currentValues);
        this.previousValues = Collections.unmodifiableMap(previousValues);
    }

    public double closeValue() {
        return close.doubleValue();
    }

    public double current(IndicatorKey key) {
        return require(currentValues, key, "current");
    }

    public double previous(IndicatorKey key) {
        return require(previousValues, key, "previous");
    }

    /**
     * @return the defined current values keyed by indicator name, in key order
     */
    public Map<String, Double> definedValues() {
        Map<String, Double> values = new LinkedHashMap<>();
        currentValues.forEach((key, value) -> {
            if (!Double.isNaN(value)) {
                values.put(key.getKey(), value);
            }
        });
        return values;
    }

    private double require(Map<IndicatorKey, Double> values, IndicatorKey key, String position) {
        Double value = values.get(key);
        if (value == null || Double.isNaN(value)) {
            throw new InsufficientDataException(
                    String.format("%s %s is undefined after %d bars", position, key.getKey(), barCount));
        }
        return value;
    }
}
