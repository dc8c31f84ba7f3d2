package com.pulsewatch.core.detection;

import com.pulsewatch.core.model.DetectorKind;
import com.pulsewatch.core.util.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Local outlier factor detector over the {@link FeatureExtractor} features.
 *
 * <p>
 * A point whose local reachability density is much lower than that of its
 * {@code k} nearest neighbours gets a factor well above 1. Points in the top
 * {@code contamination} fraction with a factor above {@code lofThreshold} are
 * flagged. Because density is judged relative to the neighbourhood, findings
 * are reported as contextual anomalies.
 * </p>
 *
 * <h3>Cost</h3>
 * <p>
 * Neighbour search is exhaustive, {@code O(n²)} in the number of analysed
 * points, which is why only the most recent {@code maxPoints} are analysed.
 * </p>
 *
 * @since 1.0.0
 */
public class LocalOutlierFactorDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(LocalOutlierFactorDetector.class);

    static final int MIN_POINTS = 20;
    private static final double EPSILON = 1e-10;

    private final int neighbors;
    private final double contamination;
    private final double threshold;
    private final int featureWindow;
    private final int minDataPoints;
    private final int maxPoints;

    public LocalOutlierFactorDetector(int neighbors, double contamination, double threshold,
            int featureWindow, int minDataPoints, int maxPoints) {
        if (neighbors < 1) {
            throw new IllegalArgumentException("neighbors must be >= 1, got: " + neighbors);
        }
        if (!(contamination > 0 && contamination < 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5), got: " + contamination);
        }
        this.neighbors = neighbors;
        this.contamination = contamination;
        this.threshold = threshold;
        this.featureWindow = featureWindow;
        this.minDataPoints = Math.max(MIN_POINTS, minDataPoints);
        this.maxPoints = maxPoints;
    }

    @Override
    public List<DetectorFinding> detect(MetricSeries series) {
        MetricSeries window = series.tail(maxPoints);
        int offset = series.size() - window.size();
        double[] values = SeriesChecks.finiteValues(window, "lof");
        if (values.length < minDataPoints) {
            return List.of();
        }

        double[] lof = factors(FeatureExtractor.extract(values, featureWindow));
        double cutoff = Statistics.percentile(Statistics.sortedCopy(lof), 100.0 * (1.0 - contamination));
        FeatureExtractor.RobustBaseline baseline = new FeatureExtractor.RobustBaseline(values);

        List<DetectorFinding> findings = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (lof[i] >= cutoff && lof[i] > threshold) {
                findings.add(new DetectorFinding(DetectorKind.LOCAL_OUTLIER_FACTOR, offset + i,
                        baseline.score(values[i]), baseline.median(), lof[i]));
            }
        }
        LOG.debug("{}: LOF flagged {} of {} point(s) (cutoff={})", series, findings.size(), values.length, cutoff);
        return findings;
    }

    /**
     * Local outlier factor of every row.
     */
    double[] factors(double[][] x) {
        int n = x.length;
        int k = Math.min(neighbors, n - 1);
        double[][] dist = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double d = distance(x[i], x[j]);
                dist[i][j] = d;
                dist[j][i] = d;
            }
        }

        // k-distance and neighbourhoods, ties included
        double[] kDistance = new double[n];
        int[][] neighbourhood = new int[n][];
        for (int p = 0; p < n; p++) {
            double[] others = new double[n - 1];
            int idx = 0;
            for (int o = 0; o < n; o++) {
                if (o != p) {
                    others[idx++] = dist[p][o];
                }
            }
            Arrays.sort(others);
            kDistance[p] = others[k - 1];
            int count = 0;
            int[] members = new int[n - 1];
            for (int o = 0; o < n; o++) {
                if (o != p && dist[p][o] <= kDistance[p]) {
                    members[count++] = o;
                }
            }
            neighbourhood[p] = Arrays.copyOf(members, count);
        }

        double[] lrd = new double[n];
        for (int p = 0; p < n; p++) {
            double reach = 0;
            for (int o : neighbourhood[p]) {
                reach += Math.max(kDistance[o], dist[p][o]);
            }
            lrd[p] = 1.0 / (reach / neighbourhood[p].length + EPSILON);
        }

        double[] lof = new double[n];
        for (int p = 0; p < n; p++) {
            double sum = 0;
            for (int o : neighbourhood[p]) {
                sum += lrd[o];
            }
            lof[p] = (sum / neighbourhood[p].length) / lrd[p];
        }
        return lof;
    }

    private static double distance(double[] a, double[] b) {
        double sum = 0;
        for (int f = 0; f < a.length; f++) {
            double d = a[f] - b[f];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.LOCAL_OUTLIER_FACTOR;
    }
}
