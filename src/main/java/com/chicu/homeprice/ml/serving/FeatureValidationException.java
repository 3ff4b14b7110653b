package com.chicu.homeprice.ml.serving;

import java.util.List;

public class FeatureValidationException extends RuntimeException {

    private final List<String> invalidFeatures;

    public FeatureValidationException(List<String> invalidFeatures) {
        super("missing or non-finite features: " + invalidFeatures);
        this.invalidFeatures = List.copyOf(invalidFeatures);
    }

    public List<String> getInvalidFeatures() {
        return invalidFeatures;
    }
}
