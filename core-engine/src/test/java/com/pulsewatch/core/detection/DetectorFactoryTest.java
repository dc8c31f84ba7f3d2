package com.pulsewatch.core.detection;

import com.pulsewatch.core.model.DetectionMethod;
import com.pulsewatch.core.model.DetectorKind;
import com.pulsewatch.core.model.DetectorParameters;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorFactory}.
 */
class DetectorFactoryTest {

    @ParameterizedTest
    @EnumSource(DetectorKind.class)
    @DisplayName("Should create a detector for every kind")
    void shouldCreateEveryKind(DetectorKind kind) {
        AnomalyDetector detector = DetectorFactory.create(kind, new DetectorParameters());
        assertThat(detector.kind()).isEqualTo(kind);
    }

    @Test
    @DisplayName("Should create ZScoreDetector for ZSCORE")
    void shouldCreateZScoreDetector() {
        assertThat(DetectorFactory.create(DetectorKind.ZSCORE, new DetectorParameters()))
                .isInstanceOf(ZScoreDetector.class);
    }

    @Test
    @DisplayName("Should run the configured statistical test alone for STATISTICAL")
    void shouldBuildStatisticalVoter() {
        DetectorParameters params = new DetectorParameters();
        params.setStatisticalTest(DetectorKind.IQR);

        EnsembleVoter voter = DetectorFactory.forMethod(DetectionMethod.STATISTICAL, params);

        assertThat(voter.detectorKinds()).containsExactly(DetectorKind.IQR);
        assertThat(voter.getVotingThreshold()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should map LOF to the local outlier factor detector")
    void shouldBuildLofVoter() {
        EnsembleVoter voter = DetectorFactory.forMethod(DetectionMethod.LOF, new DetectorParameters());
        assertThat(voter.detectorKinds()).containsExactly(DetectorKind.LOCAL_OUTLIER_FACTOR);
    }

    @Test
    @DisplayName("Should build the configured ensemble with its voting threshold")
    void shouldBuildEnsembleVoter() {
        DetectorParameters params = new DetectorParameters();
        params.setDetectors(List.of(DetectorKind.ZSCORE, DetectorKind.IQR, DetectorKind.TREND_SHIFT));
        params.setVotingThreshold(3);

        EnsembleVoter voter = DetectorFactory.forMethod(DetectionMethod.ENSEMBLE, params);

        assertThat(voter.detectorKinds())
                .containsExactly(DetectorKind.ZSCORE, DetectorKind.IQR, DetectorKind.TREND_SHIFT);
        assertThat(voter.getVotingThreshold()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should throw for null arguments")
    void shouldThrowForNull() {
        assertThatThrownBy(() -> DetectorFactory.create(null, new DetectorParameters()))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("DetectorKind");
        assertThatThrownBy(() -> DetectorFactory.forMethod(DetectionMethod.ENSEMBLE, null))
                .isInstanceOf(NullPointerException.class);
    }
}
