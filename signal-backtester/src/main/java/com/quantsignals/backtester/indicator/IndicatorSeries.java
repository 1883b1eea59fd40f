package com.quantsignals.backtester.indicator;

import java.util.Arrays;

/**
 * Indicator values aligned 1:1 with the input bars. Entries inside the warm-up
 * window (or otherwise undefined) are stored as NaN.
 */
public final class IndicatorSeries {

    private final String name;
    private final double[] values;

    public IndicatorSeries(String name, double[] values) {
        this.name = name;
        this.values = values;
    }

    public String getName() {
        return name;
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public boolean isDefined(int index) {
        return index >= 0 && index < values.length && !Double.isNaN(values[index]);
    }

    /**
     * @throws InsufficientDataException if the value at {@code index} is undefined
     */
    public double valueAt(int index) {
        if (!isDefined(index)) {
            throw new InsufficientDataException(
                    name + " is undefined at index " + index + " of " + values.length);
        }
        return values[index];
    }

    public double latest() {
        return valueAt(values.length - 1);
    }

    /**
     * Raw values including NaN placeholders.
     */
    public double[] toArray() {
        return Arrays.copyOf(values, values.length);
    }

    @Override
    public String toString() {
        return name + Arrays.toString(values);
    }
}
