package com.pulsewatch.core.detection;

import com.pulsewatch.core.error.DetectorException;
import com.pulsewatch.core.model.AnomalyType;
import com.pulsewatch.core.model.DetectorKind;
import com.pulsewatch.core.model.ScoreCombination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Runs several detectors over one series and confirms the points enough of
 * them agree on.
 *
 * <h3>Voting</h3>
 * <p>
 * A point is confirmed when at least {@code votingThreshold} detectors flag
 * it. Its composite score combines the agreeing detectors' scores (mean or
 * max); its confidence is the fraction of participating detectors that agree,
 * multiplied by the agreeing findings' mean confidence.
 * </p>
 *
 * <h3>Failure isolation</h3>
 * <p>
 * A detector that throws is logged, reported in
 * {@link Outcome#getFailedDetectors()} and left out of the vote; the
 * remaining detectors still decide.
 * </p>
 *
 * @since 1.0.0
 */
public class EnsembleVoter {

    private static final Logger LOG = LoggerFactory.getLogger(EnsembleVoter.class);

    private final List<AnomalyDetector> detectors;
    private final int votingThreshold;
    private final ScoreCombination combination;

    public EnsembleVoter(List<AnomalyDetector> detectors, int votingThreshold, ScoreCombination combination) {
        Objects.requireNonNull(detectors, "detectors must not be null");
        if (detectors.isEmpty()) {
            throw new IllegalArgumentException("at least one detector is required");
        }
        if (votingThreshold < 1 || votingThreshold > detectors.size()) {
            throw new IllegalArgumentException("votingThreshold must be in [1, " + detectors.size()
                    + "], got: " + votingThreshold);
        }
        this.detectors = List.copyOf(detectors);
        this.votingThreshold = votingThreshold;
        this.combination = Objects.requireNonNull(combination, "combination must not be null");
    }

    public Outcome vote(MetricSeries series) {
        Map<Integer, List<DetectorFinding>> byIndex = new TreeMap<>();
        List<DetectorKind> failed = new ArrayList<>();
        int participating = 0;

        for (AnomalyDetector detector : detectors) {
            List<DetectorFinding> findings;
            try {
                findings = detector.detect(series);
            } catch (DetectorException e) {
                failed.add(detector.kind());
                LOG.warn("Detector {} excluded from vote on {}: {}", detector.kind(), series, e.getMessage());
                continue;
            } catch (RuntimeException e) {
                failed.add(detector.kind());
                LOG.warn("Detector {} excluded from vote on {}", detector.kind(), series,
                        new DetectorException(detector.kind().name(), "unexpected failure", e));
                continue;
            }
            participating++;
            for (DetectorFinding f : findings) {
                byIndex.computeIfAbsent(f.getIndex(), k -> new ArrayList<>()).add(f);
            }
        }

        List<Confirmation> confirmed = new ArrayList<>();
        for (Map.Entry<Integer, List<DetectorFinding>> e : byIndex.entrySet()) {
            List<DetectorFinding> agreeing = e.getValue();
            if (agreeing.size() < votingThreshold) {
                LOG.trace("{}: index {} got {} vote(s), below threshold {}",
                        series, e.getKey(), agreeing.size(), votingThreshold);
                continue;
            }
            confirmed.add(confirm(e.getKey(), agreeing, participating));
        }
        return new Outcome(confirmed, failed, participating);
    }

    private Confirmation confirm(int index, List<DetectorFinding> agreeing, int participating) {
        double combined = 0;
        double confidenceSum = 0;
        DetectorFinding top = agreeing.get(0);
        List<DetectorKind> kinds = new ArrayList<>(agreeing.size());
        for (DetectorFinding f : agreeing) {
            combined = combination == ScoreCombination.MAX ? Math.max(combined, f.getScore()) : combined + f.getScore();
            confidenceSum += f.getConfidence();
            if (f.getScore() > top.getScore()) {
                top = f;
            }
            kinds.add(f.getKind());
        }
        double score = combination == ScoreCombination.MAX ? combined : combined / agreeing.size();
        double agreement = agreeing.size() / (double) participating;
        double confidence = Math.min(1.0, agreement * (confidenceSum / agreeing.size()));
        return new Confirmation(index, score, confidence, top.getExpectedValue(), typeOf(top.getKind()), kinds);
    }

    static AnomalyType typeOf(DetectorKind kind) {
        return switch (kind) {
            case LOCAL_OUTLIER_FACTOR -> AnomalyType.CONTEXTUAL;
            case TREND_SHIFT -> AnomalyType.TREND;
            default -> AnomalyType.POINT;
        };
    }

    public int getVotingThreshold() {
        return votingThreshold;
    }

    public List<DetectorKind> detectorKinds() {
        return detectors.stream().map(AnomalyDetector::kind).toList();
    }

    // ---------------------------------------------------------------
    // Results
    // ---------------------------------------------------------------

    /**
     * Result of one vote over a series.
     */
    public static final class Outcome {
        private final List<Confirmation> confirmed;
        private final List<DetectorKind> failedDetectors;
        private final int participating;

        Outcome(List<Confirmation> confirmed, List<DetectorKind> failedDetectors, int participating) {
            this.confirmed = Collections.unmodifiableList(confirmed);
            this.failedDetectors = Collections.unmodifiableList(failedDetectors);
            this.participating = participating;
        }

        public List<Confirmation> getConfirmed() {
            return confirmed;
        }

        public List<DetectorKind> getFailedDetectors() {
            return failedDetectors;
        }

        /** Detectors that ran without failing. */
        public int getParticipating() {
            return participating;
        }
    }

    /**
     * A point confirmed by the vote.
     */
    public static final class Confirmation {
        private final int index;
        private final double score;
        private final double confidence;
        private final double expectedValue;
        private final AnomalyType type;
        private final List<DetectorKind> detectors;

        Confirmation(int index, double score, double confidence, double expectedValue,
                AnomalyType type, List<DetectorKind> detectors) {
            this.index = index;
            this.score = score;
            this.confidence = confidence;
            this.expectedValue = expectedValue;
            this.type = type;
            this.detectors = List.copyOf(detectors);
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

        public AnomalyType getType() {
            return type;
        }

        public List<DetectorKind> getDetectors() {
            return detectors;
        }

        @Override
        public String toString() {
            return "Confirmation{index=" + index + ", score=" + score + ", confidence=" + confidence
                    + ", detectors=" + detectors + '}';
        }
    }
}
