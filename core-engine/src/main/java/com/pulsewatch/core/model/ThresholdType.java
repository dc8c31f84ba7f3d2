package com.pulsewatch.core.model;

/**
 * Direction of an alert threshold comparison.
 *
 * @since 1.0.0
 */
public enum ThresholdType {

    /** Breached when the observed value is strictly greater than the threshold. */
    ABOVE,

    /** Breached when the observed value is strictly less than the threshold. */
    BELOW;

    public boolean isBreached(double observed, double threshold) {
        return switch (this) {
            case ABOVE -> observed > threshold;
            case BELOW -> observed < threshold;
        };
    }
}
