package com.chicu.homeprice.ml.registry;

import com.chicu.homeprice.ml.features.HousingFeatures;
import com.chicu.homeprice.ml.model.PricingModel;
import com.chicu.homeprice.ml.model.RidgePriceRegressor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class ArtifactStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-03T12:30:00Z"), ZoneOffset.UTC);

    @TempDir
    Path root;

    private ArtifactStore store(ObjectMapper om) {
        return new ArtifactStore(root, om, new RunIdFactory(), CLOCK);
    }

    @Test
    void emptyRegistry_isNotRegistered() {
        ArtifactStore store = store(new ObjectMapper());

        assertTrue(store.currentRunId().isEmpty());
        assertThrows(NotRegisteredException.class, store::loadCurrent);
        assertThrows(NotRegisteredException.class, store::currentRun);
        assertTrue(store.listRuns().isEmpty());
    }

    @Test
    void publish_thenLoadCurrent_returnsSameModelAndMetrics() throws Exception {
        ArtifactStore store = store(new ObjectMapper());
        PricingModel model = model();

        String runId = store.publish(model, metrics(3.1), "rf");

        assertEquals("20260103T123000Z_rf", runId);
        assertTrue(Files.isRegularFile(root.resolve("version.json")));
        assertTrue(Files.isRegularFile(root.resolve(runId).resolve("model.json")));
        assertTrue(Files.isRegularFile(root.resolve(runId).resolve("metrics.json")));

        LoadedModel loaded = store.loadCurrent();
        assertEquals(runId, loaded.runId());
        assertEquals(List.of("cv_rmse", "cv_r2", "train_rmse", "train_r2"), List.copyOf(loaded.run().metrics().keySet()));
        assertEquals(3.1, loaded.run().metrics().get(RunMetrics.CV_RMSE));
        assertEquals(HousingFeatures.SCHEMA.schemaHash(), loaded.run().schemaHash());
        assertEquals(Instant.parse("2026-01-03T12:30:00Z"), loaded.run().createdAt());

        double[] x = row(3);
        assertEquals(model.predict(x), loaded.model().predict(x));
    }

    @Test
    void sameSecondPublish_getsDisambiguatedId_andPointerMoves() {
        ArtifactStore store = store(new ObjectMapper());

        String first = store.publish(model(), metrics(3.0), "rf");
        String second = store.publish(model(), metrics(2.0), "rf");

        assertEquals("20260103T123000Z_rf_0002", second);
        assertNotEquals(first, second);
        assertEquals(second, store.currentRunId().orElseThrow());
        assertEquals(2, store.listRuns().size());
        assertEquals(2.0, store.currentRun().metrics().get(RunMetrics.CV_RMSE));
    }

    @Test
    void stagingCreatedByAnotherPublisher_isNotShared_nextIdIsUsed() throws Exception {
        // другой процесс уже создал staging, но isTaken этого ещё не увидел
        Path foreign = root.resolve(ArtifactStore.STAGING_PREFIX + "20260103T123000Z_rf");
        Files.createDirectories(foreign);
        Files.writeString(foreign.resolve("model.json"), "{}");

        RunIdFactory racyIds = new RunIdFactory() {
            private boolean first = true;

            @Override
            public String build(Instant createdAt, String tag, Predicate<String> taken) {
                if (first) {
                    first = false;
                    return super.build(createdAt, tag, id -> false);
                }
                return super.build(createdAt, tag, taken);
            }
        };
        ArtifactStore store = new ArtifactStore(root, new ObjectMapper(), racyIds, CLOCK);

        String runId = store.publish(model(), metrics(3.0), "rf");

        assertEquals("20260103T123000Z_rf_0002", runId);
        assertEquals(runId, store.currentRunId().orElseThrow());
        assertEquals("{}", Files.readString(foreign.resolve("model.json")));
        try (Stream<Path> s = Files.list(foreign)) {
            assertEquals(1, s.count());
        }
    }

    @Test
    void failureBetweenBlobAndMetrics_leavesPointerUnchanged() throws Exception {
        ObjectMapper om = spy(new ObjectMapper());
        ArtifactStore store = store(om);
        String first = store.publish(model(), metrics(3.0), "rf");

        doThrow(new IllegalStateException("disk full")).when(om).writeValueAsBytes(any(Map.class));

        RegistryException e = assertThrows(RegistryException.class,
                () -> store.publish(model(), metrics(1.0), "rf"));
        assertTrue(e.getMessage().contains("disk full"));

        assertEquals(first, store.currentRunId().orElseThrow());
        assertEquals(3.0, store.loadCurrent().run().metrics().get(RunMetrics.CV_RMSE));
        assertFalse(Files.exists(root.resolve("20260103T123000Z_rf_0002")));
        try (Stream<Path> s = Files.list(root)) {
            assertTrue(s.noneMatch(p -> p.getFileName().toString().startsWith(ArtifactStore.STAGING_PREFIX)));
        }
    }

    @Test
    void pointerToRunWithoutBlob_isCorrupt() throws Exception {
        ArtifactStore store = store(new ObjectMapper());
        String runId = store.publish(model(), metrics(3.0), "rf");

        Files.delete(root.resolve(runId).resolve(ArtifactStore.MODEL_FILE));

        assertThrows(CorruptRegistryException.class, store::loadCurrent);
        assertTrue(store.listRuns().isEmpty());
    }

    @Test
    void pointerToMissingRun_isCorrupt() throws Exception {
        ArtifactStore store = store(new ObjectMapper());
        Files.createDirectories(root);
        Files.writeString(root.resolve("version.json"), "{\"current\":\"20990101T000000Z_ghost\"}");

        assertThrows(CorruptRegistryException.class, store::loadCurrent);
    }

    @Test
    void garbledPointer_isCorrupt() throws Exception {
        ArtifactStore store = store(new ObjectMapper());
        Files.createDirectories(root);
        Files.writeString(root.resolve("version.json"), "{\"current\":");

        assertThrows(CorruptRegistryException.class, store::currentRunId);
    }

    @Test
    void invalidMetrics_areRejectedBeforeAnyWrite() {
        ArtifactStore store = store(new ObjectMapper());

        Map<String, Double> nan = new LinkedHashMap<>();
        nan.put("cv_rmse", Double.NaN);

        assertThrows(IllegalArgumentException.class, () -> store.publish(model(), Map.of(), "rf"));
        assertThrows(IllegalArgumentException.class, () -> store.publish(model(), nan, "rf"));
        assertThrows(IllegalArgumentException.class, () -> store.publish(model(), metrics(1.0), "bad tag"));
        assertTrue(store.currentRunId().isEmpty());
    }

    private static Map<String, Double> metrics(double cvRmse) {
        return RunMetrics.builder().cvRmse(cvRmse).cvR2(0.7).trainRmse(2.0).trainR2(0.8).build().toMap();
    }

    private static PricingModel model() {
        double[][] X = new double[12][13];
        double[] y = new double[12];
        for (int i = 0; i < X.length; i++) {
            X[i] = row(i);
            y[i] = 10 + 2 * X[i][5] - X[i][12];
        }
        return new RidgePriceRegressor(1.0).fit(HousingFeatures.FEATURES, X, y);
    }

    private static double[] row(int i) {
        double[] x = new double[13];
        for (int j = 0; j < 13; j++) x[j] = Math.cos(i * 1.7 + j) * (j + 1);
        return x;
    }
}
