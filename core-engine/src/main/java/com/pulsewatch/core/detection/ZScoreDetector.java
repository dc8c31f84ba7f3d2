package com.pulsewatch.core.detection;

import com.pulsewatch.core.model.DetectorKind;
import com.pulsewatch.core.util.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Statistical outlier detector based on the standard score.
 *
 * <p>
 * A value is flagged when it deviates from the series mean by more than
 * {@code sensitivity × σ}. The finding's score is {@code |z|} and its expected
 * value the mean.
 * </p>
 *
 * <h3>Degenerate input</h3>
 * <p>
 * A constant series ({@code σ = 0}) has no outliers by this test.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreDetector.class);

    private final double sensitivity;
    private final int minDataPoints;

    public ZScoreDetector(double sensitivity, int minDataPoints) {
        if (!(sensitivity > 0)) {
            throw new IllegalArgumentException("sensitivity must be > 0, got: " + sensitivity);
        }
        this.sensitivity = sensitivity;
        this.minDataPoints = Math.max(3, minDataPoints);
    }

    @Override
    public List<DetectorFinding> detect(MetricSeries series) {
        double[] values = SeriesChecks.finiteValues(series, "zscore");
        if (values.length < minDataPoints) {
            LOG.trace("{}: {} point(s) below minimum {}, skipping", series, values.length, minDataPoints);
            return List.of();
        }

        double mean = Statistics.mean(values);
        double stddev = Statistics.stdDev(values);
        if (stddev == 0) {
            return List.of();
        }

        List<DetectorFinding> findings = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            double z = Math.abs(values[i] - mean) / stddev;
            if (z > sensitivity) {
                LOG.debug("{}: z-score outlier at {} value={} mean={} stddev={} z={}",
                        series, i, values[i], mean, stddev, z);
                findings.add(new DetectorFinding(DetectorKind.ZSCORE, i, z, mean));
            }
        }
        return findings;
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.ZSCORE;
    }
}
