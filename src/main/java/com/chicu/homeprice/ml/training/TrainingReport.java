package com.chicu.homeprice.ml.training;

import com.chicu.homeprice.ml.registry.RunMetrics;
import lombok.Builder;

@Builder
public record TrainingReport(
        String runId,
        String datasetId,
        int samples,
        RunMetrics metrics
) {
}
