package com.chicu.homeprice.ml.drift;

/**
 * Откуда брать baseline RMSE (cv_rmse активного запуска).
 */
@FunctionalInterface
public interface BaselineSource {

    /**
     * @throws BaselineUnavailableException нет активного запуска или метрика битая
     */
    double baselineRmse();
}
