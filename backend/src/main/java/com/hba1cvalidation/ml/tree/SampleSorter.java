package com.hba1cvalidation.ml.tree;

import java.util.Arrays;
import java.util.Comparator;

final class SampleSorter {

    private SampleSorter() {
    }

    /**
     * Sample indices ordered by their value in the given column. Stable, so equal
     * values keep input order and the result is deterministic.
     */
    static int[] byFeature(int[] samples, double[][] x, int feature) {
        Integer[] boxed = new Integer[samples.length];
        for (int i = 0; i < samples.length; i++) {
            boxed[i] = samples[i];
        }
        Arrays.sort(boxed, Comparator.comparingDouble(s -> x[s][feature]));
        int[] sorted = new int[samples.length];
        for (int i = 0; i < sorted.length; i++) {
            sorted[i] = boxed[i];
        }
        return sorted;
    }

    static int[][] partition(int[] samples, double[][] x, int feature, double threshold) {
        int leftCount = 0;
        for (int s : samples) {
            if (x[s][feature] <= threshold) {
                leftCount++;
            }
        }
        int[] left = new int[leftCount];
        int[] right = new int[samples.length - leftCount];
        int l = 0;
        int r = 0;
        for (int s : samples) {
            if (x[s][feature] <= threshold) {
                left[l++] = s;
            } else {
                right[r++] = s;
            }
        }
        return new int[][] {left, right};
    }
}
