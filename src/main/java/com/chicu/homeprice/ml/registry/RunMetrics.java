package com.chicu.homeprice.ml.registry;

import lombok.Builder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Метрики запуска.
 * cv_*: на отложенных фолдах (это и есть baseline для дрейфа);
 * train_*: in-sample, только для мониторинга.
 */
@Builder
public record RunMetrics(
        double cvRmse,
        double cvR2,
        double trainRmse,
        double trainR2
) {

    public static final String CV_RMSE = "cv_rmse";
    public static final String CV_R2 = "cv_r2";
    public static final String TRAIN_RMSE = "train_rmse";
    public static final String TRAIN_R2 = "train_r2";

    public Map<String, Double> toMap() {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put(CV_RMSE, cvRmse);
        m.put(CV_R2, cvR2);
        m.put(TRAIN_RMSE, trainRmse);
        m.put(TRAIN_R2, trainR2);
        return m;
    }

    public static RunMetrics fromMap(Map<String, Double> m) {
        return RunMetrics.builder()
                .cvRmse(require(m, CV_RMSE))
                .cvR2(require(m, CV_R2))
                .trainRmse(require(m, TRAIN_RMSE))
                .trainR2(require(m, TRAIN_R2))
                .build();
    }

    private static double require(Map<String, Double> m, String key) {
        Double v = m != null ? m.get(key) : null;
        if (v == null || !Double.isFinite(v)) {
            throw new IllegalArgumentException("metric " + key + " is missing or not finite: " + v);
        }
        return v;
    }
}
