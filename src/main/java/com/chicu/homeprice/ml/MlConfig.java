package com.chicu.homeprice.ml;

import com.chicu.homeprice.ml.drift.DriftEvaluator;
import com.chicu.homeprice.ml.drift.DriftProperties;
import com.chicu.homeprice.ml.model.PriceRegressor;
import com.chicu.homeprice.ml.model.RidgePriceRegressor;
import com.chicu.homeprice.ml.registry.ArtifactStore;
import com.chicu.homeprice.ml.registry.MlStorageProperties;
import com.chicu.homeprice.ml.registry.RunIdFactory;
import com.chicu.homeprice.ml.serving.ServingProperties;
import com.chicu.homeprice.ml.training.CrossValidator;
import com.chicu.homeprice.ml.training.KFoldSplitter;
import com.chicu.homeprice.ml.training.TrainingProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
@EnableConfigurationProperties({
        MlStorageProperties.class,
        TrainingProperties.class,
        ServingProperties.class,
        DriftProperties.class
})
public class MlConfig {

    /**
     * Реестр живёт в ml.storage.models-dir (по умолчанию ./artifacts).
     */
    @Bean
    @ConditionalOnMissingBean
    public ArtifactStore artifactStore(MlStorageProperties props,
                                       ObjectMapper om,
                                       RunIdFactory runIds,
                                       Clock clock) {
        return new ArtifactStore(Path.of(props.getModelsDir()), om, runIds, clock);
    }

    /**
     * Сам алгоритм для сервиса непрозрачен: достаточно заменить этот bean.
     */
    @Bean
    @ConditionalOnMissingBean
    public PriceRegressor priceRegressor(TrainingProperties props) {
        return new RidgePriceRegressor(props.getRidgeAlpha());
    }

    @Bean
    @ConditionalOnMissingBean
    public CrossValidator crossValidator(TrainingProperties props) {
        return new CrossValidator(new KFoldSplitter(props.getFolds(), props.getSeed()));
    }

    @Bean
    @ConditionalOnMissingBean
    public DriftEvaluator driftEvaluator(Clock clock) {
        return new DriftEvaluator(clock);
    }
}
