package com.chicu.homeprice.web.dto;

import com.chicu.homeprice.ml.registry.RegisteredRun;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record RunInfoResponse(
        @JsonProperty("run_id") String runId,
        @JsonProperty("created_at") Instant createdAt,
        String tag,
        String algorithm,
        @JsonProperty("schema_hash") String schemaHash,
        Map<String, Double> metrics
) {

    public static RunInfoResponse of(RegisteredRun run) {
        return new RunInfoResponse(
                run.runId(),
                run.createdAt(),
                run.tag(),
                run.algorithm(),
                run.schemaHash(),
                run.metrics()
        );
    }
}
