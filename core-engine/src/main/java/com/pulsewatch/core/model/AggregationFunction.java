package com.pulsewatch.core.model;

import com.pulsewatch.core.util.Statistics;

/**
 * Function applied to the raw values of one aggregation bucket.
 *
 * @since 1.0.0
 */
public enum AggregationFunction {

    COUNT,
    SUM,
    MEAN,
    MIN,
    MAX,
    STDDEV,
    VARIANCE,
    PERCENTILE;

    /**
     * Apply this function.
     *
     * @param values     bucket values in timestamp order; must not be empty
     * @param percentile percentile in [0, 100], used by {@link #PERCENTILE} only
     * @return the aggregated value
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public double apply(double[] values, double percentile) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot aggregate an empty bucket with " + this);
        }
        return switch (this) {
            case COUNT -> values.length;
            case SUM -> Statistics.sum(values);
            case MEAN -> Statistics.mean(values);
            case MIN -> Statistics.min(values);
            case MAX -> Statistics.max(values);
            case STDDEV -> Statistics.stdDev(values);
            case VARIANCE -> Statistics.variance(values);
            case PERCENTILE -> Statistics.percentile(Statistics.sortedCopy(values), percentile);
        };
    }
}
