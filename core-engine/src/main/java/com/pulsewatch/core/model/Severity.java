package com.pulsewatch.core.model;

/**
 * Severity shared by anomalies and alerts, ordered from least to most severe.
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
