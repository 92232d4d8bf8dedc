package com.hostsentinel.core.detection;

import com.amazon.randomcutforest.RandomCutForest;

import java.util.Arrays;
import java.util.List;

/**
 * A scaler plus a Random Cut Forest fitted on one training window.
 *
 * <p>
 * The forest scores points on a positive scale where higher means more
 * anomalous. The model converts that into a decision score: the
 * {@code (1 - contamination)} quantile of the training scores is the offset
 * and {@code decision = offset - score}. A negative decision is an outlier;
 * the more negative, the more anomalous.
 * </p>
 *
 * <p>
 * Instances are immutable after {@link #fit} and may be discarded and
 * rebuilt from the buffer at any time.
 * </p>
 */
final class OutlierModel {

    private final FeatureScaler scaler;
    private final RandomCutForest forest;
    private final double offset;
    private final int trainingRows;

    private OutlierModel(FeatureScaler scaler, RandomCutForest forest, double offset, int trainingRows) {
        this.scaler = scaler;
        this.forest = forest;
        this.offset = offset;
        this.trainingRows = trainingRows;
    }

    /**
     * Fit a fresh model on raw (unscaled) rows.
     *
     * @param rows          training rows, oldest first; at least two
     * @param trees         number of trees in the forest
     * @param contamination expected outlier share of the training window
     * @param seed          random seed, for reproducible fits
     */
    static OutlierModel fit(List<double[]> rows, int trees, double contamination, long seed) {
        if (rows.size() < 2) {
            throw new IllegalArgumentException("At least 2 training rows are needed, got " + rows.size());
        }
        FeatureScaler scaler = FeatureScaler.fit(rows);
        int n = rows.size();

        RandomCutForest forest = RandomCutForest.builder()
                .dimensions(scaler.width())
                .numberOfTrees(trees)
                .sampleSize(n)
                .outputAfter(n)
                .randomSeed(seed)
                .build();

        double[][] scaled = new double[n][];
        for (int i = 0; i < n; i++) {
            scaled[i] = scaler.transform(rows.get(i));
            forest.update(scaled[i]);
        }

        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            scores[i] = forest.getAnomalyScore(scaled[i]);
        }
        double offset = quantile(scores, 1.0 - contamination);
        return new OutlierModel(scaler, forest, offset, n);
    }

    /**
     * @param raw an unscaled feature row
     * @return {@code offset - score}; negative means outlier
     */
    double decision(double[] raw) {
        return offset - forest.getAnomalyScore(scaler.transform(raw));
    }

    double offset() {
        return offset;
    }

    int trainingRows() {
        return trainingRows;
    }

    /**
     * Linear-interpolated quantile of {@code values}, {@code q} in [0, 1].
     */
    static double quantile(double[] values, double q) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double pos = q * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = (int) Math.ceil(pos);
        return sorted[lo] + (pos - lo) * (sorted[hi] - sorted[lo]);
    }
}
