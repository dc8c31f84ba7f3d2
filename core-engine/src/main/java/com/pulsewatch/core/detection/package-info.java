/**
 * Anomaly detection: pluggable detectors, ensemble voting and anomaly
 * records.
 *
 * <p>
 * Detectors implement {@link com.pulsewatch.core.detection.AnomalyDetector}
 * and are created by {@link com.pulsewatch.core.detection.DetectorFactory}.
 * The {@link com.pulsewatch.core.detection.AnomalyDetectionEngine} runs
 * detection rules and records confirmed anomalies.
 * </p>
 *
 * @since 1.0.0
 */
package com.pulsewatch.core.detection;
