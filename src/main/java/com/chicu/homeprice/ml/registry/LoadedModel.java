package com.chicu.homeprice.ml.registry;

import com.chicu.homeprice.ml.model.PricingModel;

/**
 * Загруженная активная модель + описание запуска, из которого она пришла.
 */
public record LoadedModel(
        PricingModel model,
        RegisteredRun run
) {

    public String runId() {
        return run.runId();
    }
}
