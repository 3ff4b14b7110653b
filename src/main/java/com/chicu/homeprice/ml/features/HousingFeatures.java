package com.chicu.homeprice.ml.features;

import java.util.List;

/**
 * Фиксированная схема Boston Housing: 13 входных колонок + целевая MEDV.
 */
public final class HousingFeatures {

    public static final List<String> FEATURES = List.of(
            "CRIM", "ZN", "INDUS", "CHAS", "NOX", "RM", "AGE",
            "DIS", "RAD", "TAX", "PTRATIO", "B", "LSTAT"
    );

    public static final String TARGET = "MEDV";

    public static final FeatureSchema SCHEMA = new FeatureSchema(FEATURES);

    private HousingFeatures() {
    }
}
