package com.chicu.homeprice.ml.predictionlog;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvPredictionLogReaderTest {

    @TempDir
    Path dir;

    private final CsvPredictionLogReader reader = new CsvPredictionLogReader();

    @Test
    void read_normalizesTimestamps_andMissingFeedback() throws Exception {
        Path csv = dir.resolve("predictions.csv");
        Files.write(csv, List.of(
                "id,timestamp,CRIM,RM,predicted_price,real_price",
                "a,2024-05-01T15:00:00+03:00,0.1,6.5,24.0,25.0",
                "b,2024-05-01 12:00:00,0.1,6.5,20.0,",
                "c,not-a-date,0.1,6.5,21.0,22.0",
                "d,2024-05-02,0.1,6.5,19.0,NaN"
        ), StandardCharsets.UTF_8);

        List<PredictionLogRow> rows = reader.read(csv);

        assertEquals(4, rows.size());
        assertEquals("a", rows.get(0).id());
        assertEquals(LocalDateTime.of(2024, 5, 1, 12, 0), rows.get(0).timestamp());
        assertEquals(25.0, rows.get(0).realPrice());
        assertNull(rows.get(1).realPrice());
        assertNull(rows.get(2).timestamp());
        assertEquals(LocalDateTime.of(2024, 5, 2, 0, 0), rows.get(3).timestamp());
        assertNull(rows.get(3).realPrice());
    }

    @Test
    void missingFile_isEmptyLog() {
        assertTrue(reader.read(dir.resolve("absent.csv")).isEmpty());
    }

    @Test
    void missingRequiredColumn_isRejected() throws Exception {
        Path csv = dir.resolve("bad.csv");
        Files.write(csv, List.of("timestamp,predicted_price", "2024-05-01,1.0"), StandardCharsets.UTF_8);

        assertThrows(IllegalArgumentException.class, () -> reader.read(csv));
    }
}
