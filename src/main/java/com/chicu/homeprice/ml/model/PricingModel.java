package com.chicu.homeprice.ml.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Обученная модель цены: только чтение, безопасна для параллельных predict.
 * Сериализуется Jackson'ом в model.json артефакта.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LinearPricingModel.class, name = LinearPricingModel.TYPE)
})
public interface PricingModel {

    String algorithm();

    /**
     * Имена фич в порядке вектора x.
     */
    List<String> featureNames();

    double predict(double[] x);

    default double[] predictAll(double[][] X) {
        double[] out = new double[X.length];
        for (int i = 0; i < X.length; i++) {
            out[i] = predict(X[i]);
        }
        return out;
    }
}
