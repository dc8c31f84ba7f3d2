package com.pulsewatch.core.detection;

import com.pulsewatch.core.error.DetectorException;
import com.pulsewatch.core.model.AnomalyType;
import com.pulsewatch.core.model.DetectorKind;
import com.pulsewatch.core.model.ScoreCombination;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link EnsembleVoter}.
 */
class EnsembleVoterTest {

    private final MetricSeries series = Series.of(Series.spike());

    @Test
    @DisplayName("Should confirm only indices that reach the voting threshold")
    void shouldApplyVotingThreshold() {
        EnsembleVoter voter = new EnsembleVoter(List.of(
                flags(DetectorKind.ZSCORE, 4.0, 50, 10),
                flags(DetectorKind.IQR, 6.0, 50),
                flags(DetectorKind.MODIFIED_ZSCORE, 5.0, 20)), 2, ScoreCombination.MEAN);

        EnsembleVoter.Outcome outcome = voter.vote(series);

        assertThat(outcome.getConfirmed()).hasSize(1);
        EnsembleVoter.Confirmation confirmation = outcome.getConfirmed().get(0);
        assertThat(confirmation.getIndex()).isEqualTo(50);
        assertThat(confirmation.getScore()).isEqualTo(5.0);
        assertThat(confirmation.getDetectors()).containsExactly(DetectorKind.ZSCORE, DetectorKind.IQR);
        assertThat(outcome.getParticipating()).isEqualTo(3);
        assertThat(outcome.getFailedDetectors()).isEmpty();
    }

    @Test
    @DisplayName("Should combine scores with MAX when configured")
    void shouldCombineWithMax() {
        EnsembleVoter voter = new EnsembleVoter(List.of(
                flags(DetectorKind.ZSCORE, 4.0, 50),
                flags(DetectorKind.IQR, 6.0, 50)), 2, ScoreCombination.MAX);

        assertThat(voter.vote(series).getConfirmed().get(0).getScore()).isEqualTo(6.0);
    }

    @Test
    @DisplayName("Should scale confidence by the share of detectors that agree")
    void shouldScaleConfidenceByAgreement() {
        EnsembleVoter voter = new EnsembleVoter(List.of(
                flags(DetectorKind.ZSCORE, 10.0, 50),
                flags(DetectorKind.IQR, 10.0, 50),
                flags(DetectorKind.MODIFIED_ZSCORE, 10.0),
                flags(DetectorKind.ISOLATION_FOREST, 10.0)), 2, ScoreCombination.MEAN);

        assertThat(voter.vote(series).getConfirmed().get(0).getConfidence()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("Should exclude failing detectors and keep voting with the rest")
    void shouldIsolateDetectorFailures() {
        EnsembleVoter voter = new EnsembleVoter(List.of(
                failing(DetectorKind.ISOLATION_FOREST, new DetectorException("isolation_forest", "boom")),
                failing(DetectorKind.LOCAL_OUTLIER_FACTOR, new IllegalStateException("bug")),
                flags(DetectorKind.ZSCORE, 7.0, 50)), 1, ScoreCombination.MEAN);

        EnsembleVoter.Outcome outcome = voter.vote(series);

        assertThat(outcome.getFailedDetectors())
                .containsExactly(DetectorKind.ISOLATION_FOREST, DetectorKind.LOCAL_OUTLIER_FACTOR);
        assertThat(outcome.getParticipating()).isEqualTo(1);
        assertThat(outcome.getConfirmed()).extracting(EnsembleVoter.Confirmation::getIndex).containsExactly(50);
        assertThat(outcome.getConfirmed().get(0).getConfidence()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should type the anomaly after the strongest detector")
    void shouldTypeByStrongestDetector() {
        EnsembleVoter voter = new EnsembleVoter(List.of(
                flags(DetectorKind.ZSCORE, 3.0, 50),
                flags(DetectorKind.TREND_SHIFT, 8.0, 50)), 2, ScoreCombination.MEAN);

        assertThat(voter.vote(series).getConfirmed().get(0).getType()).isEqualTo(AnomalyType.TREND);
        assertThat(EnsembleVoter.typeOf(DetectorKind.LOCAL_OUTLIER_FACTOR)).isEqualTo(AnomalyType.CONTEXTUAL);
        assertThat(EnsembleVoter.typeOf(DetectorKind.IQR)).isEqualTo(AnomalyType.POINT);
    }

    @Test
    @DisplayName("Should reject a threshold above the number of detectors")
    void shouldRejectThreshold() {
        assertThatThrownBy(() -> new EnsembleVoter(List.of(flags(DetectorKind.ZSCORE, 1.0)), 2,
                ScoreCombination.MEAN))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("votingThreshold");
        assertThatThrownBy(() -> new EnsembleVoter(List.of(), 1, ScoreCombination.MEAN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static AnomalyDetector flags(DetectorKind kind, double score, int... indices) {
        return new AnomalyDetector() {
            @Override
            public List<DetectorFinding> detect(MetricSeries s) {
                return Arrays.stream(indices)
                        .mapToObj(i -> new DetectorFinding(kind, i, score, 100.0))
                        .toList();
            }

            @Override
            public DetectorKind kind() {
                return kind;
            }
        };
    }

    private static AnomalyDetector failing(DetectorKind kind, RuntimeException error) {
        return new AnomalyDetector() {
            @Override
            public List<DetectorFinding> detect(MetricSeries s) {
                throw error;
            }

            @Override
            public DetectorKind kind() {
                return kind;
            }
        };
    }
}
