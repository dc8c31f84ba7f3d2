/**
 * Domain model classes for Pulsewatch.
 *
 * <p>
 * This package contains the value types shared by every engine component and
 * the service layer:
 * </p>
 * <ul>
 * <li>{@link com.pulsewatch.core.model.MetricPoint} — one ingested
 * observation</li>
 * <li>{@link com.pulsewatch.core.model.AggregationRule} and
 * {@link com.pulsewatch.core.model.AggregatedPoint} — rollup configuration and
 * output</li>
 * <li>{@link com.pulsewatch.core.model.DetectionRule} and
 * {@link com.pulsewatch.core.model.Anomaly} — detection configuration and
 * output</li>
 * <li>{@link com.pulsewatch.core.model.Alert} and
 * {@link com.pulsewatch.core.model.AlertEvent} — threshold rules and their
 * firings</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.pulsewatch.core.model;
