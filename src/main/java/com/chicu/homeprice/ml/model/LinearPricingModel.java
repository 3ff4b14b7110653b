package com.chicu.homeprice.ml.model;

import java.util.List;

/**
 * Линейная модель: импутация медианой -> стандартизация -> intercept + coef·z.
 * Все параметры хранятся явно, поэтому загруженная из model.json модель
 * даёт ровно те же предсказания, что и обученная.
 */
public record LinearPricingModel(
        List<String> featureNames,
        double[] medians,
        double[] means,
        double[] scales,
        double intercept,
        double[] coefficients,
        double alpha
) implements PricingModel {

    public static final String TYPE = "ridge-linear";

    public LinearPricingModel {
        featureNames = List.copyOf(featureNames);
        int f = featureNames.size();
        if (medians.length != f || means.length != f || scales.length != f || coefficients.length != f) {
            throw new IllegalArgumentException("model parameter sizes differ from features=" + f);
        }
    }

    @Override
    public String algorithm() {
        return TYPE;
    }

    @Override
    public double predict(double[] x) {
        if (x == null || x.length != coefficients.length) {
            throw new IllegalArgumentException("feature vector size mismatch: expected=" + coefficients.length
                    + " got=" + (x == null ? "null" : x.length));
        }
        double yHat = intercept;
        for (int j = 0; j < coefficients.length; j++) {
            double v = Double.isFinite(x[j]) ? x[j] : medians[j];
            yHat += coefficients[j] * ((v - means[j]) / scales[j]);
        }
        return yHat;
    }
}
