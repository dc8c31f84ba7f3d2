package com.pulsewatch.core.detection;

import com.pulsewatch.core.model.DetectorKind;
import com.pulsewatch.core.util.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Isolation-forest detector over the {@link FeatureExtractor} features.
 *
 * <p>
 * Points that random axis-aligned splits isolate in few steps get an
 * isolation score close to 1. A point is flagged when its score is in the top
 * {@code contamination} fraction of the series <em>and</em> above
 * {@code isolationThreshold}. The reported score is the point's robust
 * deviation from the median; the isolation score is kept as the raw score.
 * </p>
 *
 * <h3>Determinism</h3>
 * <p>
 * Trees are grown from a seeded {@link Random}, so the same series and
 * parameters always produce the same findings.
 * </p>
 *
 * @since 1.0.0
 */
public class IsolationForestDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(IsolationForestDetector.class);

    static final int MIN_POINTS = 10;
    private static final double EULER_GAMMA = 0.5772156649;

    private final int trees;
    private final int sampleSize;
    private final long seed;
    private final double contamination;
    private final double threshold;
    private final int featureWindow;
    private final int minDataPoints;
    private final int maxPoints;

    public IsolationForestDetector(int trees, int sampleSize, long seed, double contamination,
            double threshold, int featureWindow, int minDataPoints, int maxPoints) {
        if (trees < 1 || sampleSize < 2) {
            throw new IllegalArgumentException("trees must be >= 1 and sampleSize >= 2");
        }
        if (!(contamination > 0 && contamination < 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5), got: " + contamination);
        }
        this.trees = trees;
        this.sampleSize = sampleSize;
        this.seed = seed;
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
        double[] values = SeriesChecks.finiteValues(window, "isolation_forest");
        if (values.length < minDataPoints) {
            return List.of();
        }

        double[][] features = FeatureExtractor.extract(values, featureWindow);
        double[] scores = score(features);
        double cutoff = Statistics.percentile(Statistics.sortedCopy(scores), 100.0 * (1.0 - contamination));
        FeatureExtractor.RobustBaseline baseline = new FeatureExtractor.RobustBaseline(values);

        List<DetectorFinding> findings = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (scores[i] >= cutoff && scores[i] > threshold) {
                findings.add(new DetectorFinding(DetectorKind.ISOLATION_FOREST, offset + i,
                        baseline.score(values[i]), baseline.median(), scores[i]));
            }
        }
        LOG.debug("{}: isolation forest flagged {} of {} point(s) (cutoff={})",
                series, findings.size(), values.length, cutoff);
        return findings;
    }

    /**
     * Average isolation score of every row over the forest.
     */
    double[] score(double[][] features) {
        int n = features.length;
        int psi = Math.min(sampleSize, n);
        int heightLimit = (int) Math.ceil(Math.log(psi) / Math.log(2));
        Random random = new Random(seed);

        double[] pathSums = new double[n];
        for (int t = 0; t < trees; t++) {
            int[] sample = sample(n, psi, random);
            Node root = grow(features, sample, 0, heightLimit, random);
            for (int i = 0; i < n; i++) {
                pathSums[i] += pathLength(features[i], root, 0);
            }
        }

        double norm = averagePathLength(psi);
        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            double mean = pathSums[i] / trees;
            scores[i] = norm > 0 ? Math.pow(2.0, -mean / norm) : 0.5;
        }
        return scores;
    }

    // ---------------------------------------------------------------
    // Tree construction
    // ---------------------------------------------------------------

    private static int[] sample(int n, int size, Random random) {
        int[] all = new int[n];
        for (int i = 0; i < n; i++) {
            all[i] = i;
        }
        // partial Fisher-Yates
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = all[i];
            all[i] = all[j];
            all[j] = tmp;
        }
        int[] out = new int[size];
        System.arraycopy(all, 0, out, 0, size);
        return out;
    }

    private static Node grow(double[][] x, int[] rows, int depth, int heightLimit, Random random) {
        if (depth >= heightLimit || rows.length <= 1) {
            return Node.leaf(rows.length);
        }
        int features = x[0].length;
        List<Integer> splittable = new ArrayList<>(features);
        double[] mins = new double[features];
        double[] maxs = new double[features];
        for (int f = 0; f < features; f++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int r : rows) {
                min = Math.min(min, x[r][f]);
                max = Math.max(max, x[r][f]);
            }
            mins[f] = min;
            maxs[f] = max;
            if (max > min) {
                splittable.add(f);
            }
        }
        if (splittable.isEmpty()) {
            return Node.leaf(rows.length);
        }

        int feature = splittable.get(random.nextInt(splittable.size()));
        double split = mins[feature] + random.nextDouble() * (maxs[feature] - mins[feature]);
        int leftCount = 0;
        for (int r : rows) {
            if (x[r][feature] < split) {
                leftCount++;
            }
        }
        int[] left = new int[leftCount];
        int[] right = new int[rows.length - leftCount];
        int li = 0;
        int ri = 0;
        for (int r : rows) {
            if (x[r][feature] < split) {
                left[li++] = r;
            } else {
                right[ri++] = r;
            }
        }
        return Node.split(feature, split,
                grow(x, left, depth + 1, heightLimit, random),
                grow(x, right, depth + 1, heightLimit, random));
    }

    private static double pathLength(double[] row, Node node, int depth) {
        Node current = node;
        int d = depth;
        while (!current.isLeaf()) {
            current = row[current.feature] < current.threshold ? current.left : current.right;
            d++;
        }
        return d + averagePathLength(current.size);
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree of
     * {@code n} nodes.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.ISOLATION_FOREST;
    }

    private static final class Node {
        final int feature;
        final double threshold;
        final Node left;
        final Node right;
        final int size;

        private Node(int feature, double threshold, Node left, Node right, int size) {
            this.feature = feature;
            this.threshold = threshold;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, 0, null, null, size);
        }

        static Node split(int feature, double threshold, Node left, Node right) {
            return new Node(feature, threshold, left, right, 0);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
