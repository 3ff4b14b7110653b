package com.chicu.homeprice.ml.predictionlog;

import com.chicu.homeprice.common.time.UtcTimestamps;

import java.time.LocalDateTime;

/**
 * Строка журнала в том виде, в каком её видит оценка дрейфа.
 * timestamp уже нормализован в UTC; null = время не распарсилось (строка невалидна).
 */
public record PredictionLogRow(
        String id,
        LocalDateTime timestamp,
        double predictedPrice,
        Double realPrice
) {

    public static PredictionLogRow from(PredictionLogEntry e) {
        return new PredictionLogRow(
                e.getId() != null ? e.getId().toString() : null,
                UtcTimestamps.normalize(e.getTimestamp()),
                e.getPredictedPrice(),
                e.getRealPrice()
        );
    }

    public boolean hasFeedback() {
        return realPrice != null;
    }
}
