package com.hba1cvalidation.ml;

import java.util.Arrays;

/**
 * Immutable model input. Layout is defined by {@link FeatureVectorizer}: the
 * standardized value block first, then one 0/1 missingness bit per optional field.
 */
public final class FeatureVector {

    private final double[] values;

    FeatureVector(double[] values) {
        this.values = values.clone();
    }

    public int size() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public double[] toArray() {
        return values.clone();
    }

    /**
     * Whether the value at the given value-block index was supplied rather than imputed.
     */
    public boolean isPresent(int valueIndex) {
        int bit = FeatureVectorizer.missingBitForValue(valueIndex);
        return bit < 0 || values[bit] == 0.0;
    }

    FeatureVector withValue(int index, double value) {
        double[] copy = values.clone();
        copy[index] = value;
        return new FeatureVector(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector other)) return false;
        return Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + Arrays.toString(values);
    }
}
