package com.chicu.homeprice.ml.metrics;

import lombok.Builder;

/**
 * RMSE / MAE / R² по паре векторов (факт, прогноз).
 */
@Builder
public record RegressionScore(
        int n,
        double rmse,
        double mae,
        double r2
) {

    public static RegressionScore of(double[] yTrue, double[] yPred) {
        if (yTrue == null || yPred == null) throw new IllegalArgumentException("yTrue/yPred is null");
        if (yTrue.length != yPred.length) {
            throw new IllegalArgumentException("sizes differ: yTrue=" + yTrue.length + " yPred=" + yPred.length);
        }
        int n = yTrue.length;
        if (n == 0) throw new IllegalArgumentException("cannot score an empty sample");

        double mean = 0.0;
        for (double v : yTrue) mean += v;
        mean /= n;

        double ssRes = 0.0;
        double absSum = 0.0;
        double ssTot = 0.0;
        for (int i = 0; i < n; i++) {
            double err = yTrue[i] - yPred[i];
            ssRes += err * err;
            absSum += Math.abs(err);
            double d = yTrue[i] - mean;
            ssTot += d * d;
        }

        double r2;
        if (ssTot == 0.0) {
            // константный факт: идеальное совпадение = 1, иначе 0
            r2 = ssRes == 0.0 ? 1.0 : 0.0;
        } else {
            r2 = 1.0 - ssRes / ssTot;
        }

        return RegressionScore.builder()
                .n(n)
                .rmse(Math.sqrt(ssRes / n))
                .mae(absSum / n)
                .r2(r2)
                .build();
    }
}
