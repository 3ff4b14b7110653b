package com.chicu.homeprice.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PredictResponse(
        String id,
        @JsonProperty("predicted_price") double predictedPrice,
        @JsonProperty("run_id") String runId
) {
}
