package com.chicu.homeprice.ml.drift;

import com.chicu.homeprice.common.time.UtcTimestamps;
import com.chicu.homeprice.ml.metrics.RegressionScore;
import com.chicu.homeprice.ml.predictionlog.PredictionLogRow;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Решение о деградации по журналу предсказаний.
 * Чистая логика: журнал и baseline передаются снаружи, время берётся из {@link Clock}.
 * <p>
 * Порядок:
 * <ol>
 *     <li>пустой журнал или ни одного real_price: INSUFFICIENT_DATA;</li>
 *     <li>записи с нераспарсенным временем выбрасываются;</li>
 *     <li>окно: timestamp &gt;= now_utc - windowDays и real_price != null;</li>
 *     <li>меньше minFeedback: INSUFFICIENT_FEEDBACK;</li>
 *     <li>rmse / mae / r2 по окну;</li>
 *     <li>baseline = cv_rmse активного запуска;</li>
 *     <li>degraded = rmse &gt; baseline * (1 + threshold), строго.</li>
 * </ol>
 */
@Slf4j
public class DriftEvaluator {

    private final Clock clock;

    public DriftEvaluator(Clock clock) {
        this.clock = clock;
    }

    public EvaluationResult evaluate(List<PredictionLogRow> rows,
                                     int windowDays,
                                     int minFeedback,
                                     double threshold,
                                     BaselineSource baseline) {
        if (windowDays <= 0) throw new IllegalArgumentException("windowDays must be > 0, got " + windowDays);
        if (minFeedback < 1) throw new IllegalArgumentException("minFeedback must be >= 1, got " + minFeedback);
        if (!Double.isFinite(threshold) || threshold < 0) {
            throw new IllegalArgumentException("threshold must be a finite number >= 0, got " + threshold);
        }
        if (baseline == null) throw new IllegalArgumentException("baseline=null");

        List<PredictionLogRow> entries = rows != null ? rows : List.of();
        int total = entries.size();

        if (total == 0) {
            log.info("📉 DRIFT no-op: prediction log is empty");
            return EvaluationResult.insufficientData("prediction log is empty", windowDays, 0);
        }
        if (entries.stream().noneMatch(PredictionLogRow::hasFeedback)) {
            log.info("📉 DRIFT no-op: no feedback in {} entries", total);
            return EvaluationResult.insufficientData("no entry has real_price", windowDays, total);
        }

        LocalDateTime now = UtcTimestamps.nowUtc(clock);
        LocalDateTime cutoff = now.minusDays(windowDays);

        int invalid = 0;
        List<PredictionLogRow> window = new ArrayList<>();
        for (PredictionLogRow r : entries) {
            if (r.timestamp() == null) {
                invalid++;
                continue;
            }
            if (!r.timestamp().isBefore(cutoff) && r.hasFeedback()) {
                window.add(r);
            }
        }

        log.info("📉 DRIFT window={}d now={} cutoff={} total={} invalidTs={} feedbackInWindow={} required={}",
                windowDays, now, cutoff, total, invalid, window.size(), minFeedback);

        if (window.size() < minFeedback) {
            return EvaluationResult.insufficientFeedback(windowDays, cutoff, total, invalid, window.size(), minFeedback);
        }

        double[] yTrue = new double[window.size()];
        double[] yPred = new double[window.size()];
        for (int i = 0; i < window.size(); i++) {
            yTrue[i] = window.get(i).realPrice();
            yPred[i] = window.get(i).predictedPrice();
        }
        RegressionScore score = RegressionScore.of(yTrue, yPred);

        double baselineRmse = baseline.baselineRmse();
        if (!Double.isFinite(baselineRmse) || baselineRmse < 0) {
            throw new BaselineUnavailableException("baseline cv_rmse is not a valid number: " + baselineRmse);
        }

        boolean degraded = score.rmse() > baselineRmse * (1.0 + threshold);

        EvaluationDecision decision = EvaluationDecision.builder()
                .windowDays(windowDays)
                .nFeedback(window.size())
                .rmse(score.rmse())
                .mae(score.mae())
                .r2(score.r2())
                .baselineRmse(baselineRmse)
                .threshold(threshold)
                .degraded(degraded)
                .build();

        if (degraded) {
            log.warn("📉 DRIFT DEGRADED rmse={} baseline={} limit={} mae={} r2={} n={}",
                    score.rmse(), baselineRmse, decision.limitRmse(), score.mae(), score.r2(), window.size());
        } else {
            log.info("📉 DRIFT OK rmse={} baseline={} limit={} mae={} r2={} n={}",
                    score.rmse(), baselineRmse, decision.limitRmse(), score.mae(), score.r2(), window.size());
        }

        return EvaluationResult.decided(decision, cutoff, total, invalid, minFeedback);
    }
}
