package com.floorpilot.shared.util;

import java.util.Arrays;

public final class StatisticsReducer {

    public double mean(double[] values) {
        requireValues(values);
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /**
     * Population standard deviation.
     */
    public double standardDeviation(double[] values) {
        double mean = mean(values);
        double squares = 0.0;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }
        return Math.sqrt(squares / values.length);
    }

    public double median(double[] values) {
        requireValues(values);
        double[] copy = Arrays.copyOf(values, values.length);
        Arrays.sort(copy);
        int middle = copy.length / 2;
        if (copy.length % 2 == 0) {
            return (copy[middle - 1] + copy[middle]) / 2.0;
        }
        return copy[middle];
    }

    public double min(double[] values) {
        requireValues(values);
        return Arrays.stream(values).min().getAsDouble();
    }

    public double max(double[] values) {
        requireValues(values);
        return Arrays.stream(values).max().getAsDouble();
    }

    /**
     * Trailing moving average; entry {@code i} averages the last
     * {@code window} values up to and including {@code i}.
     */
    public double[] movingAverage(double[] values, int window) {
        if (window <= 0) {
            throw new IllegalArgumentException("window must be positive");
        }
        double[] averages = new double[values.length];
        double running = 0.0;
        for (int i = 0; i < values.length; i++) {
            running += values[i];
            if (i >= window) {
                running -= values[i - window];
            }
            averages[i] = running / Math.min(i + 1, window);
        }
        return averages;
    }

    public double boundedRatio(double numerator, double denominator) {
        if (denominator <= 0) {
            return 0.0;
        }
        double ratio = numerator / denominator;
        return Math.max(0.0, Math.min(1.0, ratio));
    }

    private static void requireValues(double[] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("values empty");
        }
    }
}
