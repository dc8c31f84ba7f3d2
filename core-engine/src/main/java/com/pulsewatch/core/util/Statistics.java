package com.pulsewatch.core.util;

import java.util.Arrays;

/**
 * Descriptive statistics over primitive arrays.
 *
 * <p>
 * Standard deviation and variance are population statistics (divide by
 * {@code n}). Percentiles use linear interpolation between closest ranks.
 * </p>
 *
 * @since 1.0.0
 */
public final class Statistics {

    private Statistics() {
        // utility class — not instantiable
    }

    public static double sum(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum;
    }

    public static double mean(double[] values) {
        return values.length == 0 ? 0.0 : sum(values) / values.length;
    }

    public static double min(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
        }
        return values.length == 0 ? 0.0 : min;
    }

    public static double max(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            max = Math.max(max, v);
        }
        return values.length == 0 ? 0.0 : max;
    }

    public static double variance(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
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

    public static double[] sortedCopy(double[] values) {
        double[] copy = Arrays.copyOf(values, values.length);
        Arrays.sort(copy);
        return copy;
    }

    /**
     * Percentile of an already sorted array.
     *
     * @param sorted     ascending values
     * @param percentile in [0, 100]
     * @return interpolated percentile, or 0 for an empty array
     */
    public static double percentile(double[] sorted, double percentile) {
        if (sorted.length == 0) {
            return 0.0;
        }
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = (percentile / 100.0) * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        double fraction = rank - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }

    public static double median(double[] values) {
        return percentile(sortedCopy(values), 50.0);
    }

    /**
     * Median absolute deviation around the median.
     */
    public static double medianAbsoluteDeviation(double[] values, double median) {
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        return median(deviations);
    }

    /**
     * Ordinary least squares slope of {@code values[from, to)} against their
     * index.
     */
    public static double slope(double[] values, int from, int to) {
        int n = to - from;
        if (n < 2) {
            return 0.0;
        }
        double meanX = (n - 1) / 2.0;
        double meanY = 0;
        for (int i = from; i < to; i++) {
            meanY += values[i];
        }
        meanY /= n;
        double num = 0;
        double den = 0;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            num += dx * (values[from + i] - meanY);
            den += dx * dx;
        }
        return den == 0 ? 0.0 : num / den;
    }
}
