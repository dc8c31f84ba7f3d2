package com.pulsewatch.core.detection;

import com.pulsewatch.core.error.DetectorException;
import com.pulsewatch.core.model.DetectorKind;

import java.util.List;

/**
 * Contract for all anomaly detectors.
 *
 * <p>
 * Implementations are <strong>stateless</strong> between calls: each
 * invocation of {@link #detect(MetricSeries)} analyses the supplied series on
 * its own, so one instance may serve many series and threads.
 * </p>
 * <p>
 * A series shorter than the detector's minimum yields no findings. Input the
 * detector cannot analyse (for example non-finite values) raises a
 * {@link DetectorException}, which the ensemble isolates.
 * </p>
 *
 * @since 1.0.0
 */
public interface AnomalyDetector {

    /**
     * Analyse a series.
     *
     * @param series the series to scan
     * @return findings ordered by index, empty if nothing is unusual
     * @throws DetectorException if the series cannot be analysed
     */
    List<DetectorFinding> detect(MetricSeries series);

    /**
     * Return the kind of detector, used for voting and reporting.
     *
     * @return detector kind
     */
    DetectorKind kind();
}
