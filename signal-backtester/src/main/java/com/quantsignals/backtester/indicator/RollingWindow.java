package com.quantsignals.backtester.indicator;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Fixed-capacity window over the most recent values.
 * Aggregates are recomputed in insertion order on every call so results do not
 * depend on how many values have passed through the window.
 */
class RollingWindow {

    private final int capacity;
    private final Deque<Double> values;

    RollingWindow(int capacity) {
        this.capacity = capacity;
        this.values = new ArrayDeque<>(capacity);
    }

    void add(double value) {
        values.addLast(value);
        if (values.size() > capacity) {
            values.removeFirst();
        }
    }

    boolean isFull() {
        return values.size() == capacity;
    }

    int size() {
        return values.size();
    }

    double mean() {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    /**
     * Sample standard deviation (n - 1 denominator). NaN for fewer than two values.
     */
    double sampleStdDev() {
        int n = values.size();
        if (n < 2) {
            return Double.NaN;
        }
        double mean = mean();
        double sumSquares = 0.0;
        for (double value : values) {
            double diff = value - mean;
            sumSquares += diff * diff;
        }
        return Math.sqrt(sumSquares / (n - 1));
    }

    double max() {
        double max = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            max = Math.max(max, value);
        }
        return max;
    }

    double min() {
        double min = Double.POSITIVE_INFINITY;
        for (double value : values) {
            min = Math.min(min, value);
        }
        return min;
    }
}
