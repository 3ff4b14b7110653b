package com.chicu.homeprice.cli;

import com.chicu.homeprice.ml.drift.DriftEvaluationService;
import com.chicu.homeprice.ml.drift.DriftProperties;
import com.chicu.homeprice.ml.drift.EvaluationResult;
import com.chicu.homeprice.ml.training.ModelTrainingService;
import com.chicu.homeprice.ml.training.TrainingProperties;
import com.chicu.homeprice.ml.training.TrainingReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Команды того же jar без веб-сервера:
 * <pre>
 *   --command=train    [--data-path=...] [--tag=...]
 *   --command=evaluate [--window-days=N] [--min-feedback=N] [--threshold=X] [--log-file=...]
 * </pre>
 * Код выхода см. {@link DecisionExitCodes}.
 */
@Slf4j
@Component
@Order(10)
@RequiredArgsConstructor
public class MlCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String OPT_COMMAND = "command";
    static final String CMD_TRAIN = "train";
    static final String CMD_EVALUATE = "evaluate";

    private final ModelTrainingService trainingService;
    private final DriftEvaluationService evaluationService;
    private final TrainingProperties trainingProps;
    private final DriftProperties driftProps;

    private volatile int exitCode = DecisionExitCodes.OK;

    public static boolean isCommandInvocation(String[] args) {
        return args != null && Arrays.stream(args).anyMatch(a -> a != null && a.startsWith("--" + OPT_COMMAND + "="));
    }

    @Override
    public void run(ApplicationArguments args) {
        String command = single(args, OPT_COMMAND);
        if (command == null) return;

        try {
            exitCode = switch (command.trim().toLowerCase(Locale.ROOT)) {
                case CMD_TRAIN -> train(args);
                case CMD_EVALUATE -> evaluate(args);
                default -> {
                    log.error("❌ Unknown command '{}', expected {} or {}", command, CMD_TRAIN, CMD_EVALUATE);
                    yield DecisionExitCodes.FAILURE;
                }
            };
        } catch (RuntimeException e) {
            log.error("❌ Command '{}' FAILED: {}", command, e.getMessage(), e);
            exitCode = DecisionExitCodes.FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private int train(ApplicationArguments args) {
        Path data = Path.of(orDefault(single(args, "data-path"), trainingProps.getDataPath()));
        String tag = orDefault(single(args, "tag"), trainingProps.getDefaultTag());

        TrainingReport report = trainingService.trainAndRegister(data, tag);

        log.info("✅ Registered runId={} metrics={}", report.runId(), report.metrics().toMap());
        return DecisionExitCodes.OK;
    }

    private int evaluate(ApplicationArguments args) {
        int windowDays = intOpt(args, "window-days", driftProps.getWindowDays());
        int minFeedback = intOpt(args, "min-feedback", driftProps.getMinFeedback());
        double threshold = doubleOpt(args, "threshold", driftProps.getThreshold());
        String logFile = single(args, "log-file");

        EvaluationResult result = logFile != null
                ? evaluationService.evaluate(Path.of(logFile), windowDays, minFeedback, threshold)
                : evaluationService.evaluate(windowDays, minFeedback, threshold);

        int code = DecisionExitCodes.of(result);
        log.info("📉 Evaluation status={} exitCode={} reason={}", result.status(), code, result.reason());
        return code;
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) return null;
        if (values.size() > 1) {
            throw new IllegalArgumentException("option --" + name + " given more than once");
        }
        String v = values.get(0);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static String orDefault(String v, String def) {
        return v != null ? v : def;
    }

    private static int intOpt(ApplicationArguments args, String name, int def) {
        String v = single(args, name);
        if (v == null) return def;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("option --" + name + " must be an integer, got '" + v + "'", e);
        }
    }

    private static double doubleOpt(ApplicationArguments args, String name, double def) {
        String v = single(args, name);
        if (v == null) return def;
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("option --" + name + " must be a number, got '" + v + "'", e);
        }
    }
}
