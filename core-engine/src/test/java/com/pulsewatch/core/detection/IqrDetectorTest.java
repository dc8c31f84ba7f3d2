package com.pulsewatch.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link IqrDetector}.
 */
class IqrDetectorTest {

    @Test
    @DisplayName("Should flag points outside the Tukey fences")
    void shouldFlagOutsideFences() {
        List<DetectorFinding> findings = new IqrDetector(1.5, 10).detect(Series.of(Series.spike()));

        assertThat(findings).extracting(DetectorFinding::getIndex).containsExactly(50);
        DetectorFinding finding = findings.get(0);
        assertThat(finding.getExpectedValue()).isEqualTo(105.0);
        // |500 - 105| / (10 / 1.349)
        assertThat(finding.getScore()).isCloseTo(53.29, within(0.01));
    }

    @Test
    @DisplayName("Should flag low outliers too")
    void shouldFlagLowOutlier() {
        double[] values = Series.spike();
        values[50] = -300;

        assertThat(new IqrDetector(1.5, 10).detect(Series.of(values)))
                .extracting(DetectorFinding::getIndex)
                .containsExactly(50);
    }

    @Test
    @DisplayName("Should widen the fences with a larger multiplier")
    void shouldRespectMultiplier() {
        double[] values = Series.spike();
        values[50] = 130;

        assertThat(new IqrDetector(1.5, 10).detect(Series.of(values))).hasSize(1);
        assertThat(new IqrDetector(3.0, 10).detect(Series.of(values))).isEmpty();
    }

    @Test
    @DisplayName("Should find nothing in a constant series")
    void shouldIgnoreConstantSeries() {
        assertThat(new IqrDetector(1.5, 10).detect(Series.of(Series.constant(20, 7.0)))).isEmpty();
    }

    @Test
    @DisplayName("Should reject a non-positive multiplier")
    void shouldRejectMultiplier() {
        assertThatThrownBy(() -> new IqrDetector(-1, 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("multiplier");
    }
}
