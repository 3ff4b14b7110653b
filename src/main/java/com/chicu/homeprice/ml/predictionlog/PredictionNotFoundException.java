package com.chicu.homeprice.ml.predictionlog;

public class PredictionNotFoundException extends RuntimeException {

    public PredictionNotFoundException(String id) {
        super("prediction not found: " + id);
    }
}
