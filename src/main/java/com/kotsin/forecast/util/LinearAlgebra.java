package com.kotsin.forecast.util;

import com.kotsin.forecast.exception.ModelException;

/**
 * LinearAlgebra - Dense solvers for the small systems of penalized least squares.
 */
public final class LinearAlgebra {

    private LinearAlgebra() {}

    /**
     * Solve {@code A x = b} by Gaussian elimination with partial pivoting.
     * {@code a} and {@code b} are left untouched.
     *
     * @throws ModelException if the system is singular
     */
    public static double[] solve(double[][] a, double[] b) {
        int n = b.length;
        double[][] m = new double[n][];
        for (int i = 0; i < n; i++) {
            m[i] = a[i].clone();
        }
        double[] x = b.clone();

        for (int col = 0; col < n; col++) {
            int pivot = col;
            for (int row = col + 1; row < n; row++) {
                if (Math.abs(m[row][col]) > Math.abs(m[pivot][col])) {
                    pivot = row;
                }
            }
            if (Math.abs(m[pivot][col]) < 1e-12) {
                throw new ModelException("Singular system at column " + col);
            }
            double[] tmpRow = m[col];
            m[col] = m[pivot];
            m[pivot] = tmpRow;
            double tmp = x[col];
            x[col] = x[pivot];
            x[pivot] = tmp;

            for (int row = col + 1; row < n; row++) {
                double factor = m[row][col] / m[col][col];
                if (factor == 0.0) {
                    continue;
                }
                for (int k = col; k < n; k++) {
                    m[row][k] -= factor * m[col][k];
                }
                x[row] -= factor * x[col];
            }
        }

        for (int row = n - 1; row >= 0; row--) {
            double sum = x[row];
            for (int k = row + 1; k < n; k++) {
                sum -= m[row][k] * x[k];
            }
            x[row] = sum / m[row][row];
        }
        return x;
    }

    /**
     * Ridge solution of {@code min ||X w - y||^2 + sum(penalty[j] * w[j]^2)}.
     */
    public static double[] ridge(double[][] design, double[] target, double[] penalty) {
        int p = penalty.length;
        double[][] gram = new double[p][p];
        double[] rhs = new double[p];
        for (int r = 0; r < design.length; r++) {
            double[] row = design[r];
            double y = target[r];
            for (int i = 0; i < p; i++) {
                double xi = row[i];
                if (xi == 0.0) {
                    continue;
                }
                rhs[i] += xi * y;
                for (int j = i; j < p; j++) {
                    gram[i][j] += xi * row[j];
                }
            }
        }
        for (int i = 0; i < p; i++) {
            for (int j = 0; j < i; j++) {
                gram[i][j] = gram[j][i];
            }
            gram[i][i] += penalty[i];
        }
        return solve(gram, rhs);
    }

    public static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }
}
