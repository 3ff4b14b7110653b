package com.chicu.homeprice.ml.training;

import com.chicu.homeprice.ml.dataset.HousingDataset;
import com.chicu.homeprice.ml.metrics.RegressionScore;
import com.chicu.homeprice.ml.model.PriceRegressor;
import com.chicu.homeprice.ml.model.PricingModel;
import com.chicu.homeprice.ml.model.RidgePriceRegressor;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CrossValidatorTest {

    @Test
    void cvMetrics_areMeansOverHeldOutFolds() {
        HousingDataset ds = dataset(30);
        CrossValidator cv = new CrossValidator(new KFoldSplitter(5, 42));

        CrossValidator.Result r = cv.evaluate(new RidgePriceRegressor(1.0), ds);

        assertEquals(5, r.foldScores().size());
        double mean = r.foldScores().stream().mapToDouble(RegressionScore::rmse).average().orElseThrow();
        assertEquals(mean, r.cvRmse(), 1e-12);
        r.foldScores().forEach(s -> assertEquals(6, s.n()));
    }

    @Test
    void eachFold_trainsWithoutItsTestRows() {
        HousingDataset ds = dataset(10);
        List<Integer> trainSizes = new ArrayList<>();

        PriceRegressor recording = new PriceRegressor() {
            @Override
            public String algorithm() {
                return "recording";
            }

            @Override
            public PricingModel fit(List<String> featureNames, double[][] X, double[] y) {
                trainSizes.add(X.length);
                return new RidgePriceRegressor(1.0).fit(featureNames, X, y);
            }
        };

        new CrossValidator(new KFoldSplitter(5, 42)).evaluate(recording, ds);

        assertEquals(List.of(8, 8, 8, 8, 8), trainSizes);
    }

    @Test
    void sameSeed_isReproducible() {
        HousingDataset ds = dataset(40);
        CrossValidator cv = new CrossValidator(new KFoldSplitter(5, 42));

        assertEquals(cv.evaluate(new RidgePriceRegressor(1.0), ds).cvRmse(),
                cv.evaluate(new RidgePriceRegressor(1.0), ds).cvRmse());
    }

    private static HousingDataset dataset(int n) {
        double[][] X = new double[n][2];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            X[i][0] = i;
            X[i][1] = (i * 3) % 7;
            y[i] = 1 + X[i][0] + 0.5 * X[i][1] + ((i % 2 == 0) ? 0.3 : -0.3);
        }
        return new HousingDataset("t", List.of("a", "b"), X, y, n, 2);
    }
}
