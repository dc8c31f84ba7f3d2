package com.pulsewatch.core.storage;

import com.pulsewatch.core.util.Statistics;

/**
 * Summary statistics of one series over a time window, as returned by
 * {@link TimeSeriesStore#stats(String, String, int)}.
 *
 * <p>
 * An empty window yields {@link #empty()}: every aggregate is zero and
 * {@link #hasData()} is {@code false}.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricStats {

    private static final MetricStats EMPTY = new MetricStats(0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

    private final long count;
    private final double mean;
    private final double std;
    private final double min;
    private final double max;
    private final double sum;
    private final double p50;
    private final double p95;
    private final double p99;
    private final double ratePerHour;

    private MetricStats(long count, double mean, double std, double min, double max, double sum,
            double p50, double p95, double p99, double ratePerHour) {
        this.count = count;
        this.mean = mean;
        this.std = std;
        this.min = min;
        this.max = max;
        this.sum = sum;
        this.p50 = p50;
        this.p95 = p95;
        this.p99 = p99;
        this.ratePerHour = ratePerHour;
    }

    public static MetricStats empty() {
        return EMPTY;
    }

    /**
     * Compute statistics over {@code values} observed within
     * {@code windowHours}.
     */
    public static MetricStats of(double[] values, int windowHours) {
        if (values.length == 0) {
            return EMPTY;
        }
        double[] sorted = Statistics.sortedCopy(values);
        return new MetricStats(
                values.length,
                Statistics.mean(values),
                Statistics.stdDev(values),
                sorted[0],
                sorted[sorted.length - 1],
                Statistics.sum(values),
                Statistics.percentile(sorted, 50),
                Statistics.percentile(sorted, 95),
                Statistics.percentile(sorted, 99),
                windowHours > 0 ? values.length / (double) windowHours : 0.0);
    }

    public boolean hasData() {
        return count > 0;
    }

    public long getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getStd() {
        return std;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getSum() {
        return sum;
    }

    public double getP50() {
        return p50;
    }

    public double getP95() {
        return p95;
    }

    public double getP99() {
        return p99;
    }

    public double getRatePerHour() {
        return ratePerHour;
    }

    @Override
    public String toString() {
        return "MetricStats{" +
                "count=" + count +
                ", mean=" + mean +
                ", std=" + std +
                ", min=" + min +
                ", max=" + max +
                ", sum=" + sum +
                ", p50=" + p50 +
                ", p95=" + p95 +
                ", p99=" + p99 +
                ", ratePerHour=" + ratePerHour +
                '}';
    }
}
