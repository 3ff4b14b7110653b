package com.chicu.homeprice.ml.drift;

import com.chicu.homeprice.ml.registry.RunMetrics;
import com.chicu.homeprice.ml.serving.ModelHandle;
import com.chicu.homeprice.ml.training.ModelTrainingService;
import com.chicu.homeprice.ml.training.TrainingReport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DriftMonitorTest {

    @Mock private DriftEvaluationService evaluationService;
    @Mock private ModelTrainingService trainingService;
    @Mock private ModelHandle modelHandle;

    private DriftMonitor monitor;

    @AfterEach
    void tearDown() {
        if (monitor != null) monitor.shutdown();
    }

    @Test
    void degraded_withAutoRetrain_retrainsThenReloads() {
        monitor = monitor(true);
        when(evaluationService.evaluateDefault()).thenReturn(result(true));
        when(trainingService.trainAndRegisterDefault()).thenReturn(report());

        EvaluationResult r = monitor.safeCheck("test");

        assertTrue(r.isDegraded());
        var order = inOrder(trainingService, modelHandle);
        order.verify(trainingService).trainAndRegisterDefault();
        order.verify(modelHandle).reload();
    }

    @Test
    void degraded_withoutAutoRetrain_onlyReports() {
        monitor = monitor(false);
        when(evaluationService.evaluateDefault()).thenReturn(result(true));

        assertTrue(monitor.safeCheck("test").isDegraded());
        verifyNoInteractions(trainingService, modelHandle);
    }

    @Test
    void healthy_doesNotRetrain() {
        monitor = monitor(true);
        when(evaluationService.evaluateDefault()).thenReturn(result(false));

        assertFalse(monitor.safeCheck("test").isDegraded());
        verifyNoInteractions(trainingService, modelHandle);
    }

    @Test
    void failure_isLoggedNotThrown() {
        monitor = monitor(true);
        when(evaluationService.evaluateDefault()).thenThrow(new BaselineUnavailableException("no active run"));

        assertNull(monitor.safeCheck("test"));
        verifyNoInteractions(trainingService);
    }

    @Test
    void disabledSchedule_startsNothing() {
        monitor = monitor(false);
        monitor.start();
        verifyNoInteractions(evaluationService);
    }

    private DriftMonitor monitor(boolean autoRetrain) {
        DriftProperties props = new DriftProperties();
        props.setAutoRetrain(autoRetrain);
        return new DriftMonitor(evaluationService, trainingService, modelHandle, props);
    }

    private static EvaluationResult result(boolean degraded) {
        EvaluationDecision d = EvaluationDecision.builder()
                .windowDays(7).nFeedback(20)
                .rmse(degraded ? 12.0 : 9.0).mae(1.0).r2(0.5)
                .baselineRmse(10.0).threshold(0.1)
                .degraded(degraded)
                .build();
        return EvaluationResult.decided(d, null, 20, 0, 20);
    }

    private static TrainingReport report() {
        return TrainingReport.builder()
                .runId("20260110T120000Z_rf")
                .samples(100)
                .metrics(RunMetrics.builder().cvRmse(3.0).cvR2(0.7).trainRmse(2.5).trainR2(0.8).build())
                .build();
    }
}
