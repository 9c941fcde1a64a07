package com.hba1cvalidation.ml;

final class LinearAlgebra {

    private static final double SINGULAR_PIVOT = 1e-12;

    private LinearAlgebra() {
    }

    /**
     * Solves {@code a * y = b} by Gaussian elimination with partial pivoting.
     * Neither argument is modified.
     */
    static double[] solve(double[][] a, double[] b) {
        int n = b.length;
        double[][] m = new double[n][n + 1];
        for (int i = 0; i < n; i++) {
            System.arraycopy(a[i], 0, m[i], 0, n);
            m[i][n] = b[i];
        }
        for (int col = 0; col < n; col++) {
            int pivot = col;
            for (int row = col + 1; row < n; row++) {
                if (Math.abs(m[row][col]) > Math.abs(m[pivot][col])) {
                    pivot = row;
                }
            }
            if (Math.abs(m[pivot][col]) < SINGULAR_PIVOT) {
                throw new IllegalStateException("Matrix is singular at column " + col);
            }
            double[] tmp = m[col];
            m[col] = m[pivot];
            m[pivot] = tmp;
            for (int row = col + 1; row < n; row++) {
                double factor = m[row][col] / m[col][col];
                if (factor == 0.0) {
                    continue;
                }
                for (int k = col; k <= n; k++) {
                    m[row][k] -= factor * m[col][k];
                }
            }
        }
        double[] y = new double[n];
        for (int row = n - 1; row >= 0; row--) {
            double acc = m[row][n];
            for (int k = row + 1; k < n; k++) {
                acc -= m[row][k] * y[k];
            }
            y[row] = acc / m[row][row];
        }
        return y;
    }

    static double[][] submatrix(double[][] a, int[] indices) {
        double[][] sub = new double[indices.length][indices.length];
        for (int i = 0; i < indices.length; i++) {
            for (int j = 0; j < indices.length; j++) {
                sub[i][j] = a[indices[i]][indices[j]];
            }
        }
        return sub;
    }
}
