package com.chicu.homeprice.ml.model;

import java.util.Arrays;
import java.util.List;

/**
 * Ridge-регрессия через нормальные уравнения:
 * (ZᵀZ + αI)·β = Zᵀ(y - ȳ), где Z: стандартизованные фичи после импутации медианой.
 * Intercept = ȳ (на центрированных данных он не штрафуется).
 */
public class RidgePriceRegressor implements PriceRegressor {

    private final double alpha;

    public RidgePriceRegressor(double alpha) {
        if (!(alpha >= 0.0) || !Double.isFinite(alpha)) {
            throw new IllegalArgumentException("alpha must be >= 0, got " + alpha);
        }
        this.alpha = alpha;
    }

    @Override
    public String algorithm() {
        return LinearPricingModel.TYPE;
    }

    @Override
    public PricingModel fit(List<String> featureNames, double[][] X, double[] y) {
        if (X == null || y == null) throw new IllegalArgumentException("X/y is null");
        int n = X.length;
        if (n == 0) throw new IllegalArgumentException("empty training set");
        if (n != y.length) throw new IllegalArgumentException("sizes differ: X=" + n + " y=" + y.length);
        int f = featureNames.size();

        double[] medians = new double[f];
        double[] means = new double[f];
        double[] scales = new double[f];

        for (int j = 0; j < f; j++) {
            medians[j] = columnMedian(X, j);
        }

        double[][] Z = new double[n][f];
        for (int i = 0; i < n; i++) {
            if (X[i].length != f) {
                throw new IllegalArgumentException("row " + i + " has " + X[i].length + " features, expected " + f);
            }
            for (int j = 0; j < f; j++) {
                Z[i][j] = Double.isFinite(X[i][j]) ? X[i][j] : medians[j];
            }
        }

        for (int j = 0; j < f; j++) {
            double sum = 0.0;
            for (int i = 0; i < n; i++) sum += Z[i][j];
            means[j] = sum / n;

            double sq = 0.0;
            for (int i = 0; i < n; i++) {
                double d = Z[i][j] - means[j];
                sq += d * d;
            }
            double std = Math.sqrt(sq / n);
            scales[j] = std > 1e-12 ? std : 1.0; // константная колонка
        }

        double yMean = 0.0;
        for (double v : y) yMean += v;
        yMean /= n;

        for (int i = 0; i < n; i++) {
            for (int j = 0; j < f; j++) {
                Z[i][j] = (Z[i][j] - means[j]) / scales[j];
            }
        }

        double[][] A = new double[f][f];
        double[] b = new double[f];
        for (int i = 0; i < n; i++) {
            double yc = y[i] - yMean;
            for (int j = 0; j < f; j++) {
                b[j] += Z[i][j] * yc;
                for (int k = j; k < f; k++) {
                    A[j][k] += Z[i][j] * Z[i][k];
                }
            }
        }
        for (int j = 0; j < f; j++) {
            A[j][j] += alpha;
            for (int k = 0; k < j; k++) A[j][k] = A[k][j];
        }

        double[] coef = solve(A, b);

        return new LinearPricingModel(featureNames, medians, means, scales, yMean, coef, alpha);
    }

    static double columnMedian(double[][] X, int col) {
        double[] vals = new double[X.length];
        int m = 0;
        for (double[] row : X) {
            if (Double.isFinite(row[col])) vals[m++] = row[col];
        }
        if (m == 0) return 0.0; // колонка целиком пустая
        Arrays.sort(vals, 0, m);
        return (m % 2 == 1) ? vals[m / 2] : (vals[m / 2 - 1] + vals[m / 2]) / 2.0;
    }

    /**
     * Гаусс с частичным выбором главного элемента. A и b портятся.
     */
    static double[] solve(double[][] A, double[] b) {
        int f = b.length;
        for (int p = 0; p < f; p++) {
            int max = p;
            for (int r = p + 1; r < f; r++) {
                if (Math.abs(A[r][p]) > Math.abs(A[max][p])) max = r;
            }
            double[] tmp = A[p];
            A[p] = A[max];
            A[max] = tmp;
            double t = b[p];
            b[p] = b[max];
            b[max] = t;

            if (Math.abs(A[p][p]) < 1e-12) {
                // без регуляризации и с линейно зависимыми колонками
                A[p][p] = 1e-12;
            }

            for (int r = p + 1; r < f; r++) {
                double factor = A[r][p] / A[p][p];
                b[r] -= factor * b[p];
                for (int c = p; c < f; c++) {
                    A[r][c] -= factor * A[p][c];
                }
            }
        }

        double[] x = new double[f];
        for (int r = f - 1; r >= 0; r--) {
            double sum = b[r];
            for (int c = r + 1; c < f; c++) sum -= A[r][c] * x[c];
            x[r] = sum / A[r][r];
        }
        return x;
    }
}
