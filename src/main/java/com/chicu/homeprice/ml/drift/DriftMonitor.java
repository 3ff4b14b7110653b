package com.chicu.homeprice.ml.drift;

import com.chicu.homeprice.ml.serving.ModelHandle;
import com.chicu.homeprice.ml.training.ModelTrainingService;
import com.chicu.homeprice.ml.training.TrainingReport;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Периодическая оценка дрейфа внутри приложения (ml.drift.schedule-enabled).
 * С ml.drift.auto-retrain деградация сразу запускает переобучение и явную перезагрузку модели.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriftMonitor {

    private final DriftEvaluationService evaluationService;
    private final ModelTrainingService trainingService;
    private final ModelHandle modelHandle;
    private final DriftProperties props;

    private final ScheduledExecutorService scheduler =
            Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, "ml-drift"));

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> job;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!props.isScheduleEnabled()) {
            log.info("📉 Drift monitor disabled (ml.drift.schedule-enabled=false)");
            return;
        }
        if (job != null) return;

        job = scheduler.scheduleWithFixedDelay(
                () -> safeCheck("periodic"),
                props.getInitialDelay().toMillis(),
                props.getInterval().toMillis(),
                TimeUnit.MILLISECONDS
        );
        log.info("📉 Drift monitor started delay={} interval={} autoRetrain={}",
                props.getInitialDelay(), props.getInterval(), props.isAutoRetrain());
    }

    /**
     * Одна проверка. Параллельные вызовы схлопываются: пока идёт проверка, новая пропускается.
     *
     * @return результат оценки или null, если проверка уже выполняется / упала
     */
    public EvaluationResult safeCheck(String reason) {
        if (!running.compareAndSet(false, true)) {
            log.info("📉 Drift check skipped (already running) reason={}", reason);
            return null;
        }

        try {
            EvaluationResult result = evaluationService.evaluateDefault();
            log.info("📉 Drift check reason={} status={} details={}", reason, result.status(), result.reason());

            if (result.isDegraded() && props.isAutoRetrain()) {
                retrain();
            }
            return result;

        } catch (Exception e) {
            log.error("📉 Drift check FAILED reason={}: {}", reason, e.getMessage(), e);
            return null;
        } finally {
            running.set(false);
        }
    }

    private void retrain() {
        log.warn("🧠 Auto-retrain triggered by degradation");
        TrainingReport report = trainingService.trainAndRegisterDefault();
        modelHandle.reload();
        log.info("🧠 Auto-retrain done runId={} cv_rmse={}", report.runId(), report.metrics().cvRmse());
    }

    @PreDestroy
    public void shutdown() {
        ScheduledFuture<?> f = job;
        if (f != null) f.cancel(false);
        scheduler.shutdownNow();
    }
}
