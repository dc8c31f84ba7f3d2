package com.pulsewatch.core.model;

/**
 * Shape of a detected anomaly.
 *
 * <ul>
 * <li>{@code POINT}: a single value far from the rest of the series</li>
 * <li>{@code CONTEXTUAL}: unusual relative to its local neighbourhood</li>
 * <li>{@code TREND}: a change in the direction or slope of the series</li>
 * </ul>
 *
 * @since 1.0.0
 */
public enum AnomalyType {
    POINT,
    CONTEXTUAL,
    TREND
}
