package com.pulsewatch.core.detection;

import com.pulsewatch.core.model.DetectorKind;
import com.pulsewatch.core.util.Statistics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Change-point detector for trend shifts.
 *
 * <p>
 * At every index {@code i} it fits a least-squares slope to the
 * {@code window} points before and the {@code window} points from {@code i}
 * on. The slope change, scaled to the level change it produces over one
 * window and divided by the series standard deviation, is the score. Of each
 * run of consecutive indices above {@code minShift} only the strongest is
 * reported.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendShiftDetector implements AnomalyDetector {

    private final int window;
    private final double minShift;
    private final int minDataPoints;

    public TrendShiftDetector(int window, double minShift, int minDataPoints) {
        if (window < 3) {
            throw new IllegalArgumentException("window must be >= 3, got: " + window);
        }
        this.window = window;
        this.minShift = minShift;
        this.minDataPoints = Math.max(2 * window + 1, minDataPoints);
    }

    @Override
    public List<DetectorFinding> detect(MetricSeries series) {
        double[] values = SeriesChecks.finiteValues(series, "trend_shift");
        if (values.length < minDataPoints) {
            return List.of();
        }
        double sigma = Statistics.stdDev(values);
        if (sigma == 0) {
            return List.of();
        }

        List<DetectorFinding> findings = new ArrayList<>();
        DetectorFinding runBest = null;
        for (int i = window; i <= values.length - window; i++) {
            double before = Statistics.slope(values, i - window, i);
            double after = Statistics.slope(values, i, i + window);
            double shift = Math.abs(after - before) * window / sigma;
            if (shift > minShift) {
                if (runBest == null || shift > runBest.getScore()) {
                    double meanBefore = Statistics.mean(Arrays.copyOfRange(values, i - window, i));
                    double expected = meanBefore + before * (window + 1) / 2.0;
                    runBest = new DetectorFinding(DetectorKind.TREND_SHIFT, i, shift, expected);
                }
            } else if (runBest != null) {
                findings.add(runBest);
                runBest = null;
            }
        }
        if (runBest != null) {
            findings.add(runBest);
        }
        return findings;
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.TREND_SHIFT;
    }
}
