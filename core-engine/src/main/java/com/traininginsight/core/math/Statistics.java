package com.traininginsight.core.math;

import java.util.Arrays;
import java.util.Objects;

/**
 * Descriptive statistics used throughout the engine.
 *
 * <p>
 * Medians and quantiles use the lower-index convention
 * {@code sorted[floor(n * q)]} rather than interpolation, so a median is
 * always one of the observed values. Variances are population variances
 * (divide by {@code n}).
 * </p>
 *
 * @since 1.0.0
 */
public final class Statistics {

    private Statistics() {
        // utility class
    }

    public static double mean(double[] values) {
        requireNonEmpty(values);
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    public static double variance(double[] values) {
        double mean = mean(values);
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return sumSquaredDiff / values.length;
    }

    public static double stdDev(double[] values) {
        return Math.sqrt(variance(values));
    }

    /**
     * @return a sorted copy; the input is left untouched
     */
    public static double[] sorted(double[] values) {
        double[] copy = Objects.requireNonNull(values, "values must not be null").clone();
        Arrays.sort(copy);
        return copy;
    }

    /**
     * Quantile by the lower-index convention.
     *
     * @param sortedValues ascending values; must not be empty
     * @param q            quantile in [0, 1)
     * @return {@code sortedValues[floor(n * q)]}
     */
    public static double quantile(double[] sortedValues, double q) {
        requireNonEmpty(sortedValues);
        int index = (int) Math.floor(sortedValues.length * q);
        return sortedValues[Math.min(index, sortedValues.length - 1)];
    }

    public static double median(double[] values) {
        return quantile(sorted(values), 0.5);
    }

    /**
     * Median absolute deviation around the median.
     */
    public static double mad(double[] values) {
        double median = median(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        return median(deviations);
    }

    /**
     * Interquartile range {@code Q3 - Q1}.
     */
    public static double iqr(double[] values) {
        double[] sorted = sorted(values);
        return quantile(sorted, 0.75) - quantile(sorted, 0.25);
    }

    private static void requireNonEmpty(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("values must not be empty");
        }
    }
}
