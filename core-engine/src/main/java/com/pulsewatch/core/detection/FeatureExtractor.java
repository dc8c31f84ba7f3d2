package com.pulsewatch.core.detection;

import com.pulsewatch.core.util.Statistics;

/**
 * Builds the standardised feature matrix used by the model-based detectors.
 *
 * <p>
 * Row {@code i} holds three features of point {@code i}:
 * </p>
 * <ol>
 * <li>the value itself</li>
 * <li>the delta from the previous value ({@code 0} for the first point)</li>
 * <li>the rolling rate of change over the last {@code window} points</li>
 * </ol>
 * <p>
 * Each column is z-normalised; a constant column becomes all zeros.
 * </p>
 */
final class FeatureExtractor {

    static final int FEATURES = 3;

    private FeatureExtractor() {
        // utility class — not instantiable
    }

    static double[][] extract(double[] values, int window) {
        int n = values.length;
        double[][] columns = new double[FEATURES][n];
        for (int i = 0; i < n; i++) {
            columns[0][i] = values[i];
            columns[1][i] = i == 0 ? 0.0 : values[i] - values[i - 1];
            int from = Math.max(0, i - window);
            columns[2][i] = i == from ? 0.0 : (values[i] - values[from]) / (i - from);
        }
        for (double[] column : columns) {
            standardise(column);
        }

        double[][] rows = new double[n][FEATURES];
        for (int i = 0; i < n; i++) {
            for (int f = 0; f < FEATURES; f++) {
                rows[i][f] = columns[f][i];
            }
        }
        return rows;
    }

    private static void standardise(double[] column) {
        double mean = Statistics.mean(column);
        double std = Statistics.stdDev(column);
        for (int i = 0; i < column.length; i++) {
            column[i] = std == 0 ? 0.0 : (column[i] - mean) / std;
        }
    }

    /**
     * Median-centred deviation in standard-deviation equivalents, used to
     * express model findings on the common score scale.
     */
    static final class RobustBaseline {

        private static final double MAD_TO_SIGMA = 1.4826;

        private final double median;
        private final double scale;

        RobustBaseline(double[] values) {
            this.median = Statistics.median(values);
            double mad = Statistics.medianAbsoluteDeviation(values, median);
            this.scale = mad > 0 ? mad * MAD_TO_SIGMA : Statistics.stdDev(values);
        }

        double median() {
            return median;
        }

        double score(double value) {
            return scale > 0 ? Math.abs(value - median) / scale : 0.0;
        }
    }
}
