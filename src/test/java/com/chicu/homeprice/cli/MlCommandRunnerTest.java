package com.chicu.homeprice.cli;

import com.chicu.homeprice.ml.dataset.SchemaException;
import com.chicu.homeprice.ml.drift.BaselineUnavailableException;
import com.chicu.homeprice.ml.drift.DriftEvaluationService;
import com.chicu.homeprice.ml.drift.DriftProperties;
import com.chicu.homeprice.ml.drift.EvaluationDecision;
import com.chicu.homeprice.ml.drift.EvaluationResult;
import com.chicu.homeprice.ml.registry.RunMetrics;
import com.chicu.homeprice.ml.training.ModelTrainingService;
import com.chicu.homeprice.ml.training.TrainingProperties;
import com.chicu.homeprice.ml.training.TrainingReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MlCommandRunnerTest {

    @Mock private ModelTrainingService trainingService;
    @Mock private DriftEvaluationService evaluationService;

    private MlCommandRunner runner;

    @BeforeEach
    void setUp() {
        runner = new MlCommandRunner(trainingService, evaluationService, new TrainingProperties(), new DriftProperties());
    }

    @Test
    void isCommandInvocation() {
        assertTrue(MlCommandRunner.isCommandInvocation(new String[]{"--command=train"}));
        assertFalse(MlCommandRunner.isCommandInvocation(new String[]{"--server.port=8080"}));
        assertFalse(MlCommandRunner.isCommandInvocation(null));
    }

    @Test
    void withoutCommand_doesNothing() {
        runner.run(args());
        assertEquals(0, runner.getExitCode());
        verifyNoInteractions(trainingService, evaluationService);
    }

    @Test
    void train_passesDataPathAndTag() {
        when(trainingService.trainAndRegister(any(), anyString())).thenReturn(report());

        runner.run(args("--command=train", "--data-path=/data/h.csv", "--tag=exp1"));

        assertEquals(0, runner.getExitCode());
        verify(trainingService).trainAndRegister(Path.of("/data/h.csv"), "exp1");
    }

    @Test
    void train_usesConfiguredDefaults() {
        when(trainingService.trainAndRegister(any(), anyString())).thenReturn(report());

        runner.run(args("--command=train"));

        verify(trainingService).trainAndRegister(Path.of("data/HousingData.csv"), "rf");
    }

    @Test
    void upperCaseCommand_isRecognised_underTurkishDefaultLocale() {
        when(trainingService.trainAndRegister(any(), anyString())).thenReturn(report());
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            runner.run(args("--command=TRAIN"));
        } finally {
            Locale.setDefault(saved);
        }

        assertEquals(0, runner.getExitCode());
        verify(trainingService).trainAndRegister(any(), anyString());
    }

    @Test
    void trainFailure_exitsWithOne() {
        when(trainingService.trainAndRegister(any(), anyString())).thenThrow(new SchemaException(List.of("MEDV")));

        runner.run(args("--command=train"));

        assertEquals(1, runner.getExitCode());
    }

    @Test
    void evaluate_degraded_exitsWithTwo() {
        when(evaluationService.evaluate(3, 5, 0.2)).thenReturn(decided(true));

        runner.run(args("--command=evaluate", "--window-days=3", "--min-feedback=5", "--threshold=0.2"));

        assertEquals(2, runner.getExitCode());
    }

    @Test
    void evaluate_healthyOrNoOp_exitsWithZero() {
        when(evaluationService.evaluate(7, 20, 0.10)).thenReturn(EvaluationResult.insufficientData("empty", 7, 0));

        runner.run(args("--command=evaluate"));

        assertEquals(0, runner.getExitCode());
    }

    @Test
    void evaluate_logFile_readsCsv() {
        when(evaluationService.evaluate(Path.of("predictions.csv"), 7, 20, 0.10)).thenReturn(decided(false));

        runner.run(args("--command=evaluate", "--log-file=predictions.csv"));

        assertEquals(0, runner.getExitCode());
        verify(evaluationService, never()).evaluate(anyInt(), anyInt(), anyDouble());
    }

    @Test
    void evaluate_baselineUnavailable_exitsWithOne() {
        when(evaluationService.evaluate(anyInt(), anyInt(), anyDouble()))
                .thenThrow(new BaselineUnavailableException("no active run"));

        runner.run(args("--command=evaluate"));

        assertEquals(1, runner.getExitCode());
    }

    @Test
    void badOptionOrUnknownCommand_exitsWithOne() {
        runner.run(args("--command=evaluate", "--window-days=week"));
        assertEquals(1, runner.getExitCode());

        runner.run(args("--command=deploy"));
        assertEquals(1, runner.getExitCode());
    }

    private static DefaultApplicationArguments args(String... a) {
        return new DefaultApplicationArguments(a);
    }

    private static TrainingReport report() {
        return TrainingReport.builder()
                .runId("20260110T120000Z_rf")
                .samples(100)
                .metrics(RunMetrics.builder().cvRmse(3.0).cvR2(0.7).trainRmse(2.5).trainR2(0.8).build())
                .build();
    }

    private static EvaluationResult decided(boolean degraded) {
        EvaluationDecision d = EvaluationDecision.builder()
                .windowDays(7).nFeedback(20).rmse(1).mae(1).r2(0)
                .baselineRmse(1).threshold(0.1).degraded(degraded)
                .build();
        return EvaluationResult.decided(d, null, 20, 0, 20);
    }
}
