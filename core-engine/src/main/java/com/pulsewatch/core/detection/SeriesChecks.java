package com.pulsewatch.core.detection;

import com.pulsewatch.core.error.DetectorException;

import java.util.Objects;

/**
 * Input checks shared by the built-in detectors.
 */
final class SeriesChecks {

    private SeriesChecks() {
        // utility class — not instantiable
    }

    /**
     * @throws DetectorException if any value is NaN or infinite
     */
    static double[] finiteValues(MetricSeries series, String detector) {
        Objects.requireNonNull(series, "series must not be null");
        double[] values = series.values();
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new DetectorException(detector,
                        "non-finite value " + values[i] + " at index " + i + " of " + series);
            }
        }
        return values;
    }
}
