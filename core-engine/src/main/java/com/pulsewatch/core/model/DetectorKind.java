package com.pulsewatch.core.model;

/**
 * Closed set of detector implementations available to the engine.
 *
 * @since 1.0.0
 */
public enum DetectorKind {

    ZSCORE(true),
    IQR(true),
    MODIFIED_ZSCORE(true),
    ISOLATION_FOREST(false),
    LOCAL_OUTLIER_FACTOR(false),
    TREND_SHIFT(false);

    private final boolean statistical;

    DetectorKind(boolean statistical) {
        this.statistical = statistical;
    }

    /**
     * @return {@code true} for the single-pass statistical tests
     */
    public boolean isStatistical() {
        return statistical;
    }
}
