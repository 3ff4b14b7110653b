package com.chicu.homeprice.ml.registry;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

@Builder
public record RegisteredRun(
        String runId,
        Instant createdAt,
        String tag,
        String algorithm,
        String schemaHash,
        Map<String, Double> metrics
) {
}
