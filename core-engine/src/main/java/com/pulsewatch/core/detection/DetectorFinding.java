package com.pulsewatch.core.detection;

import com.pulsewatch.core.model.DetectorKind;

import java.util.Objects;

/**
 * One point a single detector flagged.
 *
 * <p>
 * {@code score} is expressed in standard-deviation equivalents for every
 * detector kind so that scores can be combined and mapped to severity bands.
 * Model-based detectors keep their native outlier score in {@code rawScore}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFinding {

    /** Score at which a finding reaches full confidence. */
    static final double FULL_CONFIDENCE_SCORE = 5.0;

    private final DetectorKind kind;
    private final int index;
    private final double score;
    private final double confidence;
    private final double expectedValue;
    private final double rawScore;

    public DetectorFinding(DetectorKind kind, int index, double score, double expectedValue, double rawScore) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, got: " + index);
        }
        this.index = index;
        this.score = score;
        this.confidence = Math.max(0.0, Math.min(1.0, score / FULL_CONFIDENCE_SCORE));
        this.expectedValue = expectedValue;
        this.rawScore = rawScore;
    }

    public DetectorFinding(DetectorKind kind, int index, double score, double expectedValue) {
        this(kind, index, score, expectedValue, score);
    }

    public DetectorKind getKind() {
        return kind;
    }

    public int getIndex() {
        return index;
    }

    public double getScore() {
        return score;
    }

    public double getConfidence() {
        return confidence;
    }

    public double getExpectedValue() {
        return expectedValue;
    }

    public double getRawScore() {
        return rawScore;
    }

    @Override
    public String toString() {
        return "DetectorFinding{" +
                "kind=" + kind +
                ", index=" + index +
                ", score=" + score +
                ", confidence=" + confidence +
                ", expectedValue=" + expectedValue +
                ", rawScore=" + rawScore +
                '}';
    }
}
