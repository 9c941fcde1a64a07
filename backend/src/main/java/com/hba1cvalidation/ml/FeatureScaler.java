package com.hba1cvalidation.ml;

import java.util.List;

/**
 * Per-column standardization fitted once on the training corpus.
 */
public final class FeatureScaler {

    private static final double MIN_STD = 1e-9;

    private final double[] means;
    private final double[] stds;

    private FeatureScaler(double[] means, double[] stds) {
        this.means = means;
        this.stds = stds;
    }

    public static FeatureScaler fit(List<double[]> rows) {
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit scaler on an empty corpus");
        }
        int width = rows.get(0).length;
        double[] means = new double[width];
        double[] stds = new double[width];
        for (double[] row : rows) {
            for (int j = 0; j < width; j++) {
                means[j] += row[j];
            }
        }
        for (int j = 0; j < width; j++) {
            means[j] /= rows.size();
        }
        for (double[] row : rows) {
            for (int j = 0; j < width; j++) {
                double d = row[j] - means[j];
                stds[j] += d * d;
            }
        }
        for (int j = 0; j < width; j++) {
            double std = Math.sqrt(stds[j] / rows.size());
            // constant column: leave centred values unscaled
            stds[j] = std < MIN_STD ? 1.0 : std;
        }
        return new FeatureScaler(means, stds);
    }

    public int width() {
        return means.length;
    }

    public double scale(int column, double raw) {
        return (raw - means[column]) / stds[column];
    }

    public double[] scale(double[] raw) {
        double[] out = new double[raw.length];
        for (int j = 0; j < raw.length; j++) {
            out[j] = scale(j, raw[j]);
        }
        return out;
    }
}
