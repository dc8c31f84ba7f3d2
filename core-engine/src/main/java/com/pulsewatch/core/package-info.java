/**
 * Multi-tenant metrics analytics core: live windows, durable history,
 * rollups, anomaly detection and alerting, composed by
 * {@link com.pulsewatch.core.AnalyticsCore}.
 *
 * @since 1.0.0
 */
package com.pulsewatch.core;
