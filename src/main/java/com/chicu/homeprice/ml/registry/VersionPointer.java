package com.chicu.homeprice.ml.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Содержимое version.json: {"current": "&lt;run_id&gt;"}.
 */
public record VersionPointer(@JsonProperty("current") String current) {
}
