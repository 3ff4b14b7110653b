package com.chicu.homeprice.ml.dataset;

import java.util.List;

/**
 * Готовый датасет для обучения.
 * X: матрица [samples][features] (NaN = пропуск)
 * y: целевая переменная [samples]
 */
public record HousingDataset(
        String datasetId,
        List<String> featureNames,
        double[][] X,
        double[] y,
        int samples,
        int features
) {

    public HousingDataset {
        if (X == null || y == null) throw new IllegalArgumentException("X/y is null");
        if (X.length != y.length) {
            throw new IllegalArgumentException("sizes differ: X=" + X.length + " y=" + y.length);
        }
        featureNames = List.copyOf(featureNames);
    }

    /**
     * Подвыборка строк по индексам (для фолдов CV).
     */
    public HousingDataset subset(int[] rows) {
        double[][] xs = new double[rows.length][];
        double[] ys = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            xs[i] = X[rows[i]];
            ys[i] = y[rows[i]];
        }
        return new HousingDataset(datasetId, featureNames, xs, ys, rows.length, features);
    }
}
