package com.pulsewatch.core.detection;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Random;

/**
 * Builds {@link MetricSeries} fixtures for detector tests.
 */
final class Series {

    static final Instant START = Instant.parse("2024-05-01T00:00:00Z");

    private Series() {
        // utility class — not instantiable
    }

    static MetricSeries of(double... values) {
        Instant[] timestamps = new Instant[values.length];
        for (int i = 0; i < values.length; i++) {
            timestamps[i] = START.plus(Duration.ofMinutes(i));
        }
        return new MetricSeries("org-a", "cpu_usage", timestamps, values);
    }

    /** 50 points alternating 105 / 95 followed by a 500 spike at index 50. */
    static double[] spike() {
        double[] values = new double[51];
        for (int i = 0; i < 50; i++) {
            values[i] = i % 2 == 0 ? 105 : 95;
        }
        values[50] = 500;
        return values;
    }

    static double[] constant(int n, double value) {
        double[] values = new double[n];
        Arrays.fill(values, value);
        return values;
    }

    static double[] gaussian(int n, double mean, double sd, long seed) {
        Random random = new Random(seed);
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = mean + sd * random.nextGaussian();
        }
        return values;
    }
}
