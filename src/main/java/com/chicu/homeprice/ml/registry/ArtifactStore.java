package com.chicu.homeprice.ml.registry;

import com.chicu.homeprice.ml.features.FeatureSchema;
import com.chicu.homeprice.ml.model.PricingModel;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * ArtifactStore
 * =============
 * Файловый реестр моделей:
 * <pre>
 * models-dir/
 *   version.json                 {"current": "20260103T123000Z_rf"}
 *   20260103T123000Z_rf/
 *     model.json                 сериализованная PricingModel
 *     metrics.json               {"cv_rmse":..,"cv_r2":..,"train_rmse":..,"train_r2":..}
 *     run.json                   run_id / created_at / tag / algorithm / schema_hash
 * </pre>
 * Каталог запуска пишется в .staging-*, целиком переименовывается на место,
 * и только последним шагом атомарно подменяется version.json.
 * Поэтому указатель никогда не смотрит на недописанный запуск.
 */
@Slf4j
public class ArtifactStore {

    static final String VERSION_FILE = "version.json";
    static final String MODEL_FILE = "model.json";
    static final String METRICS_FILE = "metrics.json";
    static final String RUN_FILE = "run.json";
    static final String STAGING_PREFIX = ".staging-";

    private static final Pattern RUN_ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]*$");
    private static final TypeReference<LinkedHashMap<String, Double>> METRICS_TYPE = new TypeReference<>() {
    };

    private final Path root;
    private final ObjectMapper om;
    private final RunIdFactory runIds;
    private final Clock clock;

    private final Object publishLock = new Object();

    public ArtifactStore(Path root, ObjectMapper om, RunIdFactory runIds, Clock clock) {
        this.root = root.toAbsolutePath().normalize();
        this.om = om;
        this.runIds = runIds;
        this.clock = clock;
    }

    public Path root() {
        return root;
    }

    // =====================================================
    // PUBLISH
    // =====================================================

    /**
     * Сохраняет модель и метрики в новый неизменяемый каталог и делает его активным.
     *
     * @return run id нового запуска
     */
    public String publish(PricingModel model, Map<String, Double> metrics, String tag) {
        if (model == null) throw new IllegalArgumentException("model=null");
        Map<String, Double> checked = checkMetrics(metrics);
        String normTag = runIds.normTag(tag);

        synchronized (publishLock) {
            Instant createdAt = clock.instant();
            Set<String> lost = new HashSet<>();
            String runId;
            Path staging;
            // staging создаётся эксклюзивно: другой процесс мог занять тот же id в ту же секунду
            while (true) {
                runId = runIds.build(createdAt, normTag, id -> lost.contains(id) || isTaken(id));
                staging = root.resolve(STAGING_PREFIX + runId);
                try {
                    Files.createDirectories(root);
                    Files.createDirectory(staging);
                    break;
                } catch (FileAlreadyExistsException e) {
                    log.warn("📦 Run id {} was taken concurrently, trying next", runId);
                    lost.add(runId);
                } catch (IOException e) {
                    throw new RegistryException("cannot create staging for run " + runId + ": " + e.getMessage(), e);
                }
            }

            Path target = root.resolve(runId);

            try {
                RunManifest manifest = new RunManifest(
                        runId,
                        createdAt.toString(),
                        normTag,
                        model.algorithm(),
                        new FeatureSchema(model.featureNames()).schemaHash()
                );
                Files.write(staging.resolve(MODEL_FILE), om.writerFor(PricingModel.class).writeValueAsBytes(model));
                Files.write(staging.resolve(METRICS_FILE), om.writeValueAsBytes(checked));
                Files.write(staging.resolve(RUN_FILE), om.writeValueAsBytes(manifest));
                move(staging, target, false);
            } catch (IOException | RuntimeException e) {
                deleteRecursively(staging);
                log.error("📦 PUBLISH FAIL runId={} err={}", runId, e.toString());
                throw new RegistryException("publish failed for run " + runId + ": " + e.getMessage(), e);
            }

            // последний шаг: только теперь запуск становится активным
            writePointer(runId);

            log.info("📦 PUBLISH OK runId={} dir={} metrics={}", runId, target, checked);
            return runId;
        }
    }

    // =====================================================
    // READ
    // =====================================================

    public Optional<String> currentRunId() {
        Path p = root.resolve(VERSION_FILE);
        if (!Files.exists(p)) return Optional.empty();

        VersionPointer vp;
        try {
            vp = om.readValue(Files.readAllBytes(p), VersionPointer.class);
        } catch (IOException e) {
            throw new CorruptRegistryException("version pointer is unreadable: " + p, e);
        }
        String id = vp != null ? vp.current() : null;
        if (id == null || !RUN_ID.matcher(id.trim()).matches()) {
            throw new CorruptRegistryException("version pointer holds an invalid run id: " + id);
        }
        return Optional.of(id.trim());
    }

    /**
     * Активный запуск без загрузки модели (метрики для /version и baseline дрейфа).
     */
    public RegisteredRun currentRun() {
        String runId = currentRunId().orElseThrow(() ->
                new NotRegisteredException("no active model: " + root.resolve(VERSION_FILE)
                        + " does not exist, train and register a model first"));
        return readRun(runId);
    }

    public LoadedModel loadCurrent() {
        RegisteredRun run = currentRun();
        Path modelPath = root.resolve(run.runId()).resolve(MODEL_FILE);
        try {
            PricingModel model = om.readValue(Files.readAllBytes(modelPath), PricingModel.class);
            return new LoadedModel(model, run);
        } catch (IOException | RuntimeException e) {
            throw new CorruptRegistryException("model blob of run " + run.runId() + " is unreadable: " + modelPath, e);
        }
    }

    public RegisteredRun readRun(String runId) {
        Path dir = root.resolve(runId);
        if (!Files.isDirectory(dir)) {
            throw new CorruptRegistryException("run " + runId + " referenced by the pointer does not exist: " + dir);
        }
        for (String f : List.of(MODEL_FILE, METRICS_FILE, RUN_FILE)) {
            if (!Files.isRegularFile(dir.resolve(f))) {
                throw new CorruptRegistryException("run " + runId + " is incomplete, missing " + f);
            }
        }

        try {
            Map<String, Double> metrics = om.readValue(Files.readAllBytes(dir.resolve(METRICS_FILE)), METRICS_TYPE);
            RunManifest manifest = om.readValue(Files.readAllBytes(dir.resolve(RUN_FILE)), RunManifest.class);
            if (manifest == null || metrics == null) {
                throw new CorruptRegistryException("run " + runId + " has empty metadata");
            }

            return RegisteredRun.builder()
                    .runId(runId)
                    .createdAt(manifest.createdAt() != null ? Instant.parse(manifest.createdAt()) : null)
                    .tag(manifest.tag())
                    .algorithm(manifest.algorithm())
                    .schemaHash(manifest.schemaHash())
                    .metrics(Collections.unmodifiableMap(new LinkedHashMap<>(metrics)))
                    .build();
        } catch (IOException | DateTimeParseException e) {
            throw new CorruptRegistryException("run " + runId + " has unreadable metadata: " + e.getMessage(), e);
        }
    }

    /**
     * Все полностью опубликованные запуски, по возрастанию run id.
     * Битые каталоги пропускаются с предупреждением.
     */
    public List<RegisteredRun> listRuns() {
        if (!Files.isDirectory(root)) return List.of();

        List<String> ids;
        try (Stream<Path> s = Files.list(root)) {
            ids = s.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .filter(n -> RUN_ID.matcher(n).matches())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new RegistryException("cannot list runs in " + root + ": " + e.getMessage(), e);
        }

        List<RegisteredRun> out = new ArrayList<>();
        for (String id : ids) {
            try {
                out.add(readRun(id));
            } catch (CorruptRegistryException e) {
                log.warn("📦 skip broken run dir={} reason={}", id, e.getMessage());
            }
        }
        return out;
    }

    // =====================================================
    // helpers
    // =====================================================

    private void writePointer(String runId) {
        Path tmp = root.resolve(VERSION_FILE + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.write(tmp, om.writeValueAsBytes(new VersionPointer(runId)));
            move(tmp, root.resolve(VERSION_FILE), true);
        } catch (IOException e) {
            deleteRecursively(tmp);
            throw new RegistryException("failed to repoint " + VERSION_FILE + " to " + runId
                    + " (run dir is written, pointer unchanged): " + e.getMessage(), e);
        }
    }

    private static void move(Path from, Path to, boolean replace) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("📦 atomic move not supported for {}, falling back to plain move", to);
            if (replace) {
                Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
            } else {
                Files.move(from, to);
            }
        }
    }

    private boolean isTaken(String runId) {
        return Files.exists(root.resolve(runId)) || Files.exists(root.resolve(STAGING_PREFIX + runId));
    }

    private static Map<String, Double> checkMetrics(Map<String, Double> metrics) {
        if (metrics == null || metrics.isEmpty()) {
            throw new IllegalArgumentException("metrics must be a non-empty mapping");
        }
        Map<String, Double> out = new LinkedHashMap<>();
        metrics.forEach((k, v) -> {
            if (k == null || k.isBlank()) throw new IllegalArgumentException("metric name is blank");
            if (v == null || !Double.isFinite(v)) {
                throw new IllegalArgumentException("metric " + k + " must be a finite number, got " + v);
            }
            out.put(k, v);
        });
        return out;
    }

    private static void deleteRecursively(Path path) {
        if (!Files.exists(path)) return;
        try (Stream<Path> s = Files.walk(path)) {
            for (Path p : s.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            log.warn("📦 cleanup failed path={} err={}", path, e.toString());
        }
    }
}
