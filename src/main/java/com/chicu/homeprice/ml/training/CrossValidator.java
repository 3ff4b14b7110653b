package com.chicu.homeprice.ml.training;

import com.chicu.homeprice.ml.dataset.HousingDataset;
import com.chicu.homeprice.ml.metrics.RegressionScore;
import com.chicu.homeprice.ml.model.PriceRegressor;
import com.chicu.homeprice.ml.model.PricingModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Оценка обобщающей ошибки: модель на каждом фолде учится без него
 * и скорится только на отложенных строках. Полная модель здесь не участвует.
 */
@Slf4j
@RequiredArgsConstructor
public class CrossValidator {

    public record Result(
            double cvRmse,
            double cvR2,
            List<RegressionScore> foldScores
    ) {
    }

    private final KFoldSplitter splitter;

    public Result evaluate(PriceRegressor regressor, HousingDataset dataset) {
        List<RegressionScore> scores = new ArrayList<>();

        for (KFoldSplitter.Fold fold : splitter.split(dataset.samples())) {
            HousingDataset train = dataset.subset(fold.train());
            HousingDataset test = dataset.subset(fold.test());

            PricingModel model = regressor.fit(train.featureNames(), train.X(), train.y());
            RegressionScore score = RegressionScore.of(test.y(), model.predictAll(test.X()));
            scores.add(score);

            log.debug("🧪 CV fold={} train={} test={} rmse={} r2={}",
                    fold.index(), fold.train().length, fold.test().length, score.rmse(), score.r2());
        }

        double rmse = scores.stream().mapToDouble(RegressionScore::rmse).average().orElse(Double.NaN);
        double r2 = scores.stream().mapToDouble(RegressionScore::r2).average().orElse(Double.NaN);

        return new Result(rmse, r2, List.copyOf(scores));
    }
}
