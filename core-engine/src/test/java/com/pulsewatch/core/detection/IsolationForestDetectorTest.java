package com.pulsewatch.core.detection;

import com.pulsewatch.core.model.DetectorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link IsolationForestDetector}.
 */
class IsolationForestDetectorTest {

    @Test
    @DisplayName("Should isolate an extreme spike in gaussian noise")
    void shouldIsolateSpike() {
        double[] values = Series.gaussian(200, 100, 5, 7L);
        values[150] = 1000;

        List<DetectorFinding> findings = forest(0.1, 1000).detect(Series.of(values));

        assertThat(findings).extracting(DetectorFinding::getIndex).contains(150);
        DetectorFinding spike = findings.stream().filter(f -> f.getIndex() == 150).findFirst().orElseThrow();
        assertThat(spike.getKind()).isEqualTo(DetectorKind.ISOLATION_FOREST);
        assertThat(spike.getRawScore()).isGreaterThan(0.6);
        assertThat(spike.getExpectedValue()).isCloseTo(100, within(2.0));
        assertThat(spike.getScore()).isGreaterThan(50);
    }

    @Test
    @DisplayName("Should never flag more than the contamination share")
    void shouldRespectContamination() {
        double[] values = Series.gaussian(200, 100, 5, 11L);

        List<DetectorFinding> findings = forest(0.05, 1000).detect(Series.of(values));

        assertThat(findings.size()).isLessThanOrEqualTo(10);
    }

    @Test
    @DisplayName("Should be deterministic for a fixed seed")
    void shouldBeDeterministic() {
        double[] values = Series.gaussian(120, 50, 3, 3L);
        values[60] = 400;

        assertThat(forest(0.1, 1000).detect(Series.of(values)))
                .usingRecursiveFieldByFieldElementComparator()
                .isEqualTo(forest(0.1, 1000).detect(Series.of(values)));
    }

    @Test
    @DisplayName("Should analyse only the most recent points and report original indices")
    void shouldReportOffsetIndices() {
        double[] values = Series.gaussian(300, 100, 5, 5L);
        values[280] = 2000;

        List<DetectorFinding> findings = forest(0.1, 100).detect(Series.of(values));

        assertThat(findings).isNotEmpty();
        assertThat(findings).allSatisfy(f -> assertThat(f.getIndex()).isGreaterThanOrEqualTo(200));
        assertThat(findings).extracting(DetectorFinding::getIndex).contains(280);
    }

    @Test
    @DisplayName("Should skip series shorter than the minimum")
    void shouldSkipShortSeries() {
        assertThat(forest(0.1, 1000).detect(Series.of(1, 2, 3, 100))).isEmpty();
    }

    @Test
    @DisplayName("Should reject contamination outside (0, 0.5)")
    void shouldRejectContamination() {
        assertThatThrownBy(() -> forest(0.5, 1000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("contamination");
    }

    @Test
    @DisplayName("Should compute the BST average path length")
    void shouldComputeAveragePathLength() {
        assertThat(IsolationForestDetector.averagePathLength(1)).isZero();
        assertThat(IsolationForestDetector.averagePathLength(2)).isEqualTo(1.0);
        assertThat(IsolationForestDetector.averagePathLength(256)).isCloseTo(10.24, within(0.01));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static IsolationForestDetector forest(double contamination, int maxPoints) {
        return new IsolationForestDetector(100, 256, 42L, contamination, 0.6, 5, 10, maxPoints);
    }
}
