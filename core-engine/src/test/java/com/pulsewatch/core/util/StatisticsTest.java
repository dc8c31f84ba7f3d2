package com.pulsewatch.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Statistics}.
 */
class StatisticsTest {

    private static final double[] VALUES = {2, 4, 4, 4, 5, 5, 7, 9};

    @Test
    @DisplayName("Should compute population mean, variance and standard deviation")
    void shouldComputeMoments() {
        assertThat(Statistics.mean(VALUES)).isEqualTo(5.0);
        assertThat(Statistics.variance(VALUES)).isEqualTo(4.0);
        assertThat(Statistics.stdDev(VALUES)).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should interpolate percentiles over sorted values")
    void shouldInterpolatePercentiles() {
        double[] sorted = Statistics.sortedCopy(new double[]{40, 10, 30, 20});

        assertThat(Statistics.percentile(sorted, 0)).isEqualTo(10.0);
        assertThat(Statistics.percentile(sorted, 100)).isEqualTo(40.0);
        assertThat(Statistics.percentile(sorted, 50)).isEqualTo(25.0);
        assertThat(Statistics.median(new double[]{3, 1, 2})).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should compute the median absolute deviation")
    void shouldComputeMad() {
        double[] values = {1, 1, 2, 2, 4, 6, 9};
        double median = Statistics.median(values);

        assertThat(median).isEqualTo(2.0);
        assertThat(Statistics.medianAbsoluteDeviation(values, median)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should fit a least-squares slope over a sub-range")
    void shouldFitSlope() {
        double[] values = {0, 0, 0, 1, 3, 5, 7};

        assertThat(Statistics.slope(values, 3, 7)).isCloseTo(2.0, within(1e-9));
        assertThat(Statistics.slope(values, 0, 3)).isCloseTo(0.0, within(1e-9));
    }
}
