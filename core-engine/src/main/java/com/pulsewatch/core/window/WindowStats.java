package com.pulsewatch.core.window;

import com.pulsewatch.core.model.MetricPoint;
import com.pulsewatch.core.util.Statistics;

import java.util.List;

/**
 * Statistics of a live window, computed on demand by
 * {@link RealTimeWindowEngine#windowStats}.
 *
 * <p>
 * An empty window has {@code count == 0} and every other figure zero.
 * {@code ratePerMinute} is the point count divided by the window length.
 * </p>
 *
 * @since 1.0.0
 */
public final class WindowStats {

    private final int windowMinutes;
    private final long count;
    private final double avg;
    private final double sum;
    private final double min;
    private final double max;
    private final double stdDev;
    private final double ratePerMinute;
    private final double lastValue;
    private final double p50;
    private final double p95;
    private final double p99;

    private WindowStats(int windowMinutes, long count, double avg, double sum, double min, double max,
            double stdDev, double ratePerMinute, double lastValue, double p50, double p95, double p99) {
        this.windowMinutes = windowMinutes;
        this.count = count;
        this.avg = avg;
        this.sum = sum;
        this.min = min;
        this.max = max;
        this.stdDev = stdDev;
        this.ratePerMinute = ratePerMinute;
        this.lastValue = lastValue;
        this.p50 = p50;
        this.p95 = p95;
        this.p99 = p99;
    }

    public static WindowStats empty(int windowMinutes) {
        return new WindowStats(windowMinutes, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    /**
     * @param points window contents, oldest first
     */
    static WindowStats of(List<MetricPoint> points, int windowMinutes) {
        if (points.isEmpty()) {
            return empty(windowMinutes);
        }
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getValue();
        }
        double[] sorted = Statistics.sortedCopy(values);
        return new WindowStats(
                windowMinutes,
                values.length,
                Statistics.mean(values),
                Statistics.sum(values),
                sorted[0],
                sorted[sorted.length - 1],
                Statistics.stdDev(values),
                values.length / (double) windowMinutes,
                values[values.length - 1],
                Statistics.percentile(sorted, 50),
                Statistics.percentile(sorted, 95),
                Statistics.percentile(sorted, 99));
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public int getWindowMinutes() {
        return windowMinutes;
    }

    public long getCount() {
        return count;
    }

    public double getAvg() {
        return avg;
    }

    public double getSum() {
        return sum;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getStdDev() {
        return stdDev;
    }

    public double getRatePerMinute() {
        return ratePerMinute;
    }

    public double getLastValue() {
        return lastValue;
    }

    public double getP50() {
        return p50;
    }

    public double getP95() {
        return p95;
    }

    public double getP99() {
        return p99;
    }

    @Override
    public String toString() {
        return "WindowStats{" +
                "windowMinutes=" + windowMinutes +
                ", count=" + count +
                ", avg=" + avg +
                ", sum=" + sum +
                ", min=" + min +
                ", max=" + max +
                ", stdDev=" + stdDev +
                ", ratePerMinute=" + ratePerMinute +
                ", lastValue=" + lastValue +
                ", p50=" + p50 +
                ", p95=" + p95 +
                ", p99=" + p99 +
                '}';
    }
}
