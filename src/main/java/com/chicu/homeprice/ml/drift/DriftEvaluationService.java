package com.chicu.homeprice.ml.drift;

import com.chicu.homeprice.ml.predictionlog.CsvPredictionLogReader;
import com.chicu.homeprice.ml.predictionlog.PredictionLogRow;
import com.chicu.homeprice.ml.predictionlog.PredictionLogService;
import com.chicu.homeprice.ml.registry.ArtifactStore;
import com.chicu.homeprice.ml.registry.RegisteredRun;
import com.chicu.homeprice.ml.registry.RegistryException;
import com.chicu.homeprice.ml.registry.RunMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Связывает {@link DriftEvaluator} с журналом (БД или старый CSV) и реестром моделей.
 * Baseline всегда читается у текущего активного запуска, поэтому каждое переобучение его обновляет.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriftEvaluationService {

    private final DriftEvaluator evaluator;
    private final PredictionLogService predictionLog;
    private final CsvPredictionLogReader csvReader;
    private final ArtifactStore artifactStore;
    private final DriftProperties props;

    public EvaluationResult evaluate(int windowDays, int minFeedback, double threshold) {
        List<PredictionLogRow> rows = predictionLog.readRows();
        return evaluator.evaluate(rows, windowDays, minFeedback, threshold, this::activeBaselineRmse);
    }

    /**
     * Оценка по журналу в CSV-файле вместо БД.
     */
    public EvaluationResult evaluate(Path logFile, int windowDays, int minFeedback, double threshold) {
        List<PredictionLogRow> rows = csvReader.read(logFile);
        log.info("📉 DRIFT source=csv file={} rows={}", logFile, rows.size());
        return evaluator.evaluate(rows, windowDays, minFeedback, threshold, this::activeBaselineRmse);
    }

    public EvaluationResult evaluateDefault() {
        return evaluate(props.getWindowDays(), props.getMinFeedback(), props.getThreshold());
    }

    double activeBaselineRmse() {
        RegisteredRun run;
        try {
            run = artifactStore.currentRun();
        } catch (RegistryException e) {
            throw new BaselineUnavailableException("no usable active run: " + e.getMessage(), e);
        }

        Double v = run.metrics() != null ? run.metrics().get(RunMetrics.CV_RMSE) : null;
        if (v == null || !Double.isFinite(v) || v < 0) {
            throw new BaselineUnavailableException("run " + run.runId() + " has no valid "
                    + RunMetrics.CV_RMSE + " (got " + v + ")");
        }
        log.debug("📉 DRIFT baseline runId={} cv_rmse={}", run.runId(), v);
        return v;
    }
}
