package com.hostsentinel.core.detection;

import java.util.List;

/**
 * Small helpers for the linear statistics used by the trend rules and the
 * failure forecast.
 *
 * @since 1.0.0
 */
public final class LinearTrend {

    private LinearTrend() {
        // utility class
    }

    /**
     * Ordinary least squares slope of {@code values} against their index
     * {@code 0..n-1}.
     *
     * <pre>
     *   m = (Σ(x·y) - n·mean_x·mean_y) / (Σ(x²) - n·mean_x²)
     * </pre>
     *
     * @param values at least two samples, oldest first
     * @return change per sample interval
     * @throws IllegalArgumentException if fewer than two samples are given
     */
    public static double slope(List<Double> values) {
        int n = values.size();
        if (n < 2) {
            throw new IllegalArgumentException("At least 2 samples are needed for a slope, got " + n);
        }

        double sumX = 0, sumY = 0, sumXY = 0, sumXSquared = 0;
        for (int i = 0; i < n; i++) {
            double y = values.get(i);
            sumX += i;
            sumY += y;
            sumXY += i * y;
            sumXSquared += (double) i * i;
        }

        double meanX = sumX / n;
        double meanY = sumY / n;
        double numerator = sumXY - n * meanX * meanY;
        double denominator = sumXSquared - n * meanX * meanX;
        return numerator / denominator;
    }

    /**
     * Mean of {@code values[from, to)}.
     *
     * @throws IllegalArgumentException if the range is empty
     */
    public static double mean(List<Double> values, int from, int to) {
        if (from < 0 || to > values.size() || from >= to) {
            throw new IllegalArgumentException("Invalid range [" + from + ", " + to
                    + ") for " + values.size() + " values");
        }
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values.get(i);
        }
        return sum / (to - from);
    }
}
