package com.pulsewatch.core.model;

/**
 * The live-window statistic an {@link Alert} compares against its threshold.
 *
 * <p>
 * {@code COUNT}, {@code SUM} and {@code RATE_PER_MINUTE} are zero for an empty
 * window; every other statistic is undefined there and never breaches.
 * </p>
 *
 * @since 1.0.0
 */
public enum AlertStatistic {

    AVG(false),
    LAST(false),
    MIN(false),
    MAX(false),
    SUM(true),
    COUNT(true),
    RATE_PER_MINUTE(true),
    P95(false),
    P99(false);

    private final boolean definedWhenEmpty;

    AlertStatistic(boolean definedWhenEmpty) {
        this.definedWhenEmpty = definedWhenEmpty;
    }

    public boolean isDefinedWhenEmpty() {
        return definedWhenEmpty;
    }
}
