package com.pulsewatch.core.detection;

import com.pulsewatch.core.model.DetectorKind;
import com.pulsewatch.core.util.Statistics;

import java.util.ArrayList;
import java.util.List;

/**
 * Tukey fence detector: flags values outside
 * {@code [Q1 − k·IQR, Q3 + k·IQR]}.
 *
 * <p>
 * The score converts the distance from the median into standard-deviation
 * equivalents using {@code σ ≈ IQR / 1.349}; for a degenerate IQR the
 * population standard deviation is used instead.
 * </p>
 *
 * @since 1.0.0
 */
public class IqrDetector implements AnomalyDetector {

    private static final double IQR_PER_SIGMA = 1.349;

    private final double multiplier;
    private final int minDataPoints;

    public IqrDetector(double multiplier, int minDataPoints) {
        if (!(multiplier > 0)) {
            throw new IllegalArgumentException("multiplier must be > 0, got: " + multiplier);
        }
        this.multiplier = multiplier;
        this.minDataPoints = Math.max(4, minDataPoints);
    }

    @Override
    public List<DetectorFinding> detect(MetricSeries series) {
        double[] values = SeriesChecks.finiteValues(series, "iqr");
        if (values.length < minDataPoints) {
            return List.of();
        }

        double[] sorted = Statistics.sortedCopy(values);
        double q1 = Statistics.percentile(sorted, 25);
        double q3 = Statistics.percentile(sorted, 75);
        double median = Statistics.percentile(sorted, 50);
        double iqr = q3 - q1;
        double lower = q1 - multiplier * iqr;
        double upper = q3 + multiplier * iqr;
        double sigma = iqr > 0 ? iqr / IQR_PER_SIGMA : Statistics.stdDev(values);
        if (sigma == 0) {
            return List.of();
        }

        List<DetectorFinding> findings = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (values[i] < lower || values[i] > upper) {
                double score = Math.abs(values[i] - median) / sigma;
                findings.add(new DetectorFinding(DetectorKind.IQR, i, score, median));
            }
        }
        return findings;
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.IQR;
    }
}
