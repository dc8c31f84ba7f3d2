package com.pulsewatch.core.detection;

import com.pulsewatch.core.model.DetectorKind;
import com.pulsewatch.core.util.Statistics;

import java.util.ArrayList;
import java.util.List;

/**
 * Robust outlier detector using the modified z-score
 * {@code M = 0.6745 · (x − median) / MAD}.
 *
 * <p>
 * Median and MAD are barely moved by the outliers themselves, so this test
 * keeps working on series that already contain extreme values. When more
 * than half the values are identical the MAD is zero; the mean absolute
 * deviation (scaled by 1.2533) stands in for it.
 * </p>
 *
 * @since 1.0.0
 */
public class ModifiedZScoreDetector implements AnomalyDetector {

    private static final double CONSISTENCY = 0.6745;
    private static final double MEAN_AD_SCALE = 1.253314;

    private final double threshold;
    private final int minDataPoints;

    public ModifiedZScoreDetector(double threshold, int minDataPoints) {
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
        }
        this.threshold = threshold;
        this.minDataPoints = Math.max(3, minDataPoints);
    }

    @Override
    public List<DetectorFinding> detect(MetricSeries series) {
        double[] values = SeriesChecks.finiteValues(series, "modified_zscore");
        if (values.length < minDataPoints) {
            return List.of();
        }

        double median = Statistics.median(values);
        double mad = Statistics.medianAbsoluteDeviation(values, median);
        double scale;
        if (mad > 0) {
            scale = mad / CONSISTENCY;
        } else {
            double meanAd = 0;
            for (double v : values) {
                meanAd += Math.abs(v - median);
            }
            meanAd /= values.length;
            scale = meanAd * MEAN_AD_SCALE;
        }
        if (scale == 0) {
            return List.of();
        }

        List<DetectorFinding> findings = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            double m = Math.abs(values[i] - median) / scale;
            if (m > threshold) {
                findings.add(new DetectorFinding(DetectorKind.MODIFIED_ZSCORE, i, m, median));
            }
        }
        return findings;
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.MODIFIED_ZSCORE;
    }
}
