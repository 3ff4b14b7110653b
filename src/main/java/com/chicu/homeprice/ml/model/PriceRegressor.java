package com.chicu.homeprice.ml.model;

import java.util.List;

/**
 * Обучаемый регрессор. Каждый fit возвращает новую независимую модель,
 * сам регрессор состояния не хранит (можно переиспользовать по фолдам CV).
 */
public interface PriceRegressor {

    String algorithm();

    PricingModel fit(List<String> featureNames, double[][] X, double[] y);
}
