package com.hostsentinel.core.detection;

import java.util.List;

/**
 * Per-column standardisation to zero mean and unit variance, fitted on one
 * training window.
 *
 * <p>
 * Columns with zero variance are only centred (divided by 1), so a field
 * that never changes contributes 0 instead of {@code NaN}.
 * </p>
 */
final class FeatureScaler {

    private final double[] means;
    private final double[] scales;

    private FeatureScaler(double[] means, double[] scales) {
        this.means = means;
        this.scales = scales;
    }

    /**
     * @param rows non-empty training rows of equal width
     */
    static FeatureScaler fit(List<double[]> rows) {
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit a scaler on zero rows");
        }
        int width = rows.get(0).length;
        int n = rows.size();
        double[] means = new double[width];
        double[] scales = new double[width];

        for (double[] row : rows) {
            if (row.length != width) {
                throw new IllegalArgumentException("Row width " + row.length + " != " + width);
            }
            for (int j = 0; j < width; j++) {
                means[j] += row[j];
            }
        }
        for (int j = 0; j < width; j++) {
            means[j] /= n;
        }

        for (double[] row : rows) {
            for (int j = 0; j < width; j++) {
                double d = row[j] - means[j];
                scales[j] += d * d;
            }
        }
        for (int j = 0; j < width; j++) {
            double std = Math.sqrt(scales[j] / n);
            scales[j] = std == 0 ? 1.0 : std;
        }
        return new FeatureScaler(means, scales);
    }

    double[] transform(double[] row) {
        if (row.length != means.length) {
            throw new IllegalArgumentException("Row width " + row.length + " != " + means.length);
        }
        double[] out = new double[row.length];
        for (int j = 0; j < row.length; j++) {
            out[j] = (row[j] - means[j]) / scales[j];
        }
        return out;
    }

    int width() {
        return means.length;
    }
}
