package com.chicu.homeprice.ml.serving;

import lombok.Builder;

import java.time.Instant;
import java.util.UUID;

@Builder
public record PredictionResult(
        UUID id,
        double predictedPrice,
        String runId,
        Instant timestamp
) {
}
