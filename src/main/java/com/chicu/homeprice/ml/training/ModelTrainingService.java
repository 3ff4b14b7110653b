package com.chicu.homeprice.ml.training;

import com.chicu.homeprice.ml.dataset.DatasetException;
import com.chicu.homeprice.ml.dataset.HousingDataset;
import com.chicu.homeprice.ml.dataset.HousingDatasetLoader;
import com.chicu.homeprice.ml.metrics.RegressionScore;
import com.chicu.homeprice.ml.model.PriceRegressor;
import com.chicu.homeprice.ml.model.PricingModel;
import com.chicu.homeprice.ml.registry.ArtifactStore;
import com.chicu.homeprice.ml.registry.RunIdFactory;
import com.chicu.homeprice.ml.registry.RunMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Полный цикл обучения:
 * 1. загрузка и проверка схемы датасета
 * 2. CV -> cv_rmse / cv_r2 (baseline для дрейфа)
 * 3. обучение на всём датасете
 * 4. in-sample train_rmse / train_r2 (только мониторинг)
 * 5. публикация в реестр
 * Любая ошибка до шага 5 прерывает запуск, реестр не трогается.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelTrainingService {

    private final HousingDatasetLoader datasetLoader;
    private final PriceRegressor regressor;
    private final CrossValidator crossValidator;
    private final ArtifactStore artifactStore;
    private final RunIdFactory runIds;
    private final TrainingProperties props;

    public TrainingReport trainAndRegister(Path dataPath, String tag) {
        String runTag = runIds.normTag((tag == null || tag.isBlank()) ? props.getDefaultTag() : tag);

        log.info("🧠 TRAIN start data={} tag={} algorithm={}", dataPath, runTag, regressor.algorithm());
        HousingDataset dataset = datasetLoader.load(dataPath);

        if (dataset.samples() < props.getFolds()) {
            throw new DatasetException("dataset has " + dataset.samples() + " rows, need at least "
                    + props.getFolds() + " for " + props.getFolds() + "-fold CV");
        }

        CrossValidator.Result cv = crossValidator.evaluate(regressor, dataset);
        log.info("🧪 CV done folds={} cv_rmse={} cv_r2={}", cv.foldScores().size(), cv.cvRmse(), cv.cvR2());

        PricingModel model = regressor.fit(dataset.featureNames(), dataset.X(), dataset.y());
        RegressionScore train = RegressionScore.of(dataset.y(), model.predictAll(dataset.X()));

        RunMetrics metrics = RunMetrics.builder()
                .cvRmse(cv.cvRmse())
                .cvR2(cv.cvR2())
                .trainRmse(train.rmse())
                .trainR2(train.r2())
                .build();

        String runId = artifactStore.publish(model, metrics.toMap(), runTag);

        log.info("🧠 TRAIN OK runId={} samples={} metrics={}", runId, dataset.samples(), metrics.toMap());

        return TrainingReport.builder()
                .runId(runId)
                .datasetId(dataset.datasetId())
                .samples(dataset.samples())
                .metrics(metrics)
                .build();
    }

    public TrainingReport trainAndRegisterDefault() {
        return trainAndRegister(Path.of(props.getDataPath()), props.getDefaultTag());
    }
}
