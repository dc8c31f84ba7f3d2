package com.pulsewatch.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed tuning parameters shared by all detector kinds.
 *
 * <p>
 * Every field has a default, so a rule only lists what it overrides. Settings
 * that no built-in detector understands go into {@link #getExtra()}.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorParameters {

    // --- Statistical ---
    /** Z-score threshold: flag {@code |x - mean| / stddev > sensitivity}. */
    private double sensitivity = 2.0;

    /** Statistical test used by {@link DetectionMethod#STATISTICAL}. */
    private DetectorKind statisticalTest = DetectorKind.ZSCORE;

    /** IQR fence multiplier {@code k}. */
    private double iqrMultiplier = 1.5;

    /** Modified z-score threshold (median / MAD based). */
    private double modifiedZThreshold = 3.5;

    // --- Model based ---
    /** Expected outlier fraction, in (0, 0.5). */
    private double contamination = 0.1;

    private int trees = 100;
    private int sampleSize = 256;
    private long seed = 42L;

    /** Minimum isolation score for a point to be flagged. */
    private double isolationThreshold = 0.6;

    private int neighbors = 20;

    /** Minimum local outlier factor for a point to be flagged. */
    private double lofThreshold = 1.5;

    /** Look-back used for the rolling-rate feature. */
    private int featureWindow = 5;

    /** Model-based detectors analyse at most this many of the most recent points. */
    private int maxModelPoints = 1000;

    // --- Trend ---
    private int trendWindow = 7;

    /** Slope change, in standard deviations per window, needed to flag a shift. */
    private double minTrendShift = 3.0;

    // --- Ensemble ---
    private int votingThreshold = 2;
    private List<DetectorKind> detectors = new ArrayList<>(List.of(
            DetectorKind.ZSCORE,
            DetectorKind.IQR,
            DetectorKind.MODIFIED_ZSCORE,
            DetectorKind.ISOLATION_FOREST,
            DetectorKind.LOCAL_OUTLIER_FACTOR));
    private ScoreCombination scoreCombination = ScoreCombination.MEAN;

    /** Series shorter than this are not analysed. */
    private int minDataPoints = 10;

    private Map<String, String> extra = new LinkedHashMap<>();

    /**
     * Append a description of every invalid value to {@code errors}.
     *
     * @param errors sink for error messages
     * @param owner  prefix identifying the owning rule
     */
    public void collectErrors(List<String> errors, String owner) {
        if (!(sensitivity > 0)) {
            errors.add(owner + " requires 'sensitivity' > 0");
        }
        if (statisticalTest == null || !statisticalTest.isStatistical()) {
            errors.add(owner + " requires 'statisticalTest' in " + statisticalKinds());
        }
        if (!(iqrMultiplier > 0)) {
            errors.add(owner + " requires 'iqrMultiplier' > 0");
        }
        if (!(modifiedZThreshold > 0)) {
            errors.add(owner + " requires 'modifiedZThreshold' > 0");
        }
        if (!(contamination > 0 && contamination < 0.5)) {
            errors.add(owner + " requires 'contamination' in (0, 0.5)");
        }
        if (trees < 1) {
            errors.add(owner + " requires 'trees' >= 1");
        }
        if (sampleSize < 2) {
            errors.add(owner + " requires 'sampleSize' >= 2");
        }
        if (neighbors < 1) {
            errors.add(owner + " requires 'neighbors' >= 1");
        }
        if (featureWindow < 1) {
            errors.add(owner + " requires 'featureWindow' >= 1");
        }
        if (maxModelPoints < 10) {
            errors.add(owner + " requires 'maxModelPoints' >= 10");
        }
        if (trendWindow < 3) {
            errors.add(owner + " requires 'trendWindow' >= 3");
        }
        if (votingThreshold < 1) {
            errors.add(owner + " requires 'votingThreshold' >= 1");
        }
        if (detectors == null || detectors.isEmpty()) {
            errors.add(owner + " requires at least one entry in 'detectors'");
        } else if (votingThreshold > detectors.size()) {
            errors.add(owner + " has 'votingThreshold' " + votingThreshold
                    + " above the number of detectors (" + detectors.size() + ")");
        }
        if (scoreCombination == null) {
            errors.add(owner + " requires 'scoreCombination'");
        }
        if (minDataPoints < 3) {
            errors.add(owner + " requires 'minDataPoints' >= 3");
        }
    }

    private static String statisticalKinds() {
        EnumSet<DetectorKind> kinds = EnumSet.noneOf(DetectorKind.class);
        for (DetectorKind k : DetectorKind.values()) {
            if (k.isStatistical()) {
                kinds.add(k);
            }
        }
        return kinds.toString();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getSensitivity() {
        return sensitivity;
    }

    public void setSensitivity(double sensitivity) {
        this.sensitivity = sensitivity;
    }

    public DetectorKind getStatisticalTest() {
        return statisticalTest;
    }

    public void setStatisticalTest(DetectorKind statisticalTest) {
        this.statisticalTest = statisticalTest;
    }

    public double getIqrMultiplier() {
        return iqrMultiplier;
    }

    public void setIqrMultiplier(double iqrMultiplier) {
        this.iqrMultiplier = iqrMultiplier;
    }

    public double getModifiedZThreshold() {
        return modifiedZThreshold;
    }

    public void setModifiedZThreshold(double modifiedZThreshold) {
        this.modifiedZThreshold = modifiedZThreshold;
    }

    public double getContamination() {
        return contamination;
    }

    public void setContamination(double contamination) {
        this.contamination = contamination;
    }

    public int getTrees() {
        return trees;
    }

    public void setTrees(int trees) {
        this.trees = trees;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

    public double getIsolationThreshold() {
        return isolationThreshold;
    }

    public void setIsolationThreshold(double isolationThreshold) {
        this.isolationThreshold = isolationThreshold;
    }

    public int getNeighbors() {
        return neighbors;
    }

    public void setNeighbors(int neighbors) {
        this.neighbors = neighbors;
    }

    public double getLofThreshold() {
        return lofThreshold;
    }

    public void setLofThreshold(double lofThreshold) {
        this.lofThreshold = lofThreshold;
    }

    public int getFeatureWindow() {
        return featureWindow;
    }

    public void setFeatureWindow(int featureWindow) {
        this.featureWindow = featureWindow;
    }

    public int getMaxModelPoints() {
        return maxModelPoints;
    }

    public void setMaxModelPoints(int maxModelPoints) {
        this.maxModelPoints = maxModelPoints;
    }

    public int getTrendWindow() {
        return trendWindow;
    }

    public void setTrendWindow(int trendWindow) {
        this.trendWindow = trendWindow;
    }

    public double getMinTrendShift() {
        return minTrendShift;
    }

    public void setMinTrendShift(double minTrendShift) {
        this.minTrendShift = minTrendShift;
    }

    public int getVotingThreshold() {
        return votingThreshold;
    }

    public void setVotingThreshold(int votingThreshold) {
        this.votingThreshold = votingThreshold;
    }

    /**
     * @return unmodifiable list of detectors run by the ensemble
     */
    public List<DetectorKind> getDetectors() {
        return Collections.unmodifiableList(detectors);
    }

    public void setDetectors(List<DetectorKind> detectors) {
        this.detectors = detectors != null ? new ArrayList<>(detectors) : new ArrayList<>();
    }

    public ScoreCombination getScoreCombination() {
        return scoreCombination;
    }

    public void setScoreCombination(ScoreCombination scoreCombination) {
        this.scoreCombination = scoreCombination;
    }

    public int getMinDataPoints() {
        return minDataPoints;
    }

    public void setMinDataPoints(int minDataPoints) {
        this.minDataPoints = minDataPoints;
    }

    /**
     * @return unmodifiable map of free-form parameters
     */
    public Map<String, String> getExtra() {
        return Collections.unmodifiableMap(extra);
    }

    public void setExtra(Map<String, String> extra) {
        this.extra = extra != null ? new LinkedHashMap<>(extra) : new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "DetectorParameters{" +
                "sensitivity=" + sensitivity +
                ", statisticalTest=" + statisticalTest +
                ", contamination=" + contamination +
                ", votingThreshold=" + votingThreshold +
                ", detectors=" + detectors +
                ", scoreCombination=" + scoreCombination +
                ", minDataPoints=" + minDataPoints +
                '}';
    }
}
