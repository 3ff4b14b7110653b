package com.chicu.homeprice.ml.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * run.json внутри каталога запуска.
 */
public record RunManifest(
        @JsonProperty("run_id") String runId,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("tag") String tag,
        @JsonProperty("algorithm") String algorithm,
        @JsonProperty("schema_hash") String schemaHash
) {
}
