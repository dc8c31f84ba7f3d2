package com.pulsewatch.core.model;

/**
 * What caused an {@link AlertEvent} to fire.
 *
 * @since 1.0.0
 */
public enum AlertEventSource {

    /** A configured {@link Alert} threshold was breached. */
    THRESHOLD,

    /** The anomaly engine recorded a sufficiently severe anomaly. */
    ANOMALY
}
