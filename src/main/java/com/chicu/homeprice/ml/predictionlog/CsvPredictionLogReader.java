package com.chicu.homeprice.ml.predictionlog;

import com.chicu.homeprice.common.time.UtcTimestamps;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Чтение журнала в старом CSV-формате (predictions.csv):
 * timestamp, predicted_price, real_price и необязательный id.
 * <p>
 * Время прогоняется через {@link UtcTimestamps}; кривое время даёт строку с timestamp=null,
 * пустой или нечисловой real_price = feedback не было.
 */
@Slf4j
@Component
public class CsvPredictionLogReader {

    static final String COL_ID = "id";
    static final String COL_TIMESTAMP = "timestamp";
    static final String COL_PREDICTED = "predicted_price";
    static final String COL_REAL = "real_price";

    private static final Set<String> MISSING = Set.of("", "na", "nan", "null", "none");

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .build();

    public List<PredictionLogRow> read(Path path) {
        if (!Files.exists(path)) {
            log.info("🧾 Prediction log {} does not exist, treating as empty", path);
            return List.of();
        }

        try (Reader r = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(r)) {

            List<String> header = parser.getHeaderNames();
            for (String col : List.of(COL_TIMESTAMP, COL_PREDICTED, COL_REAL)) {
                if (!header.contains(col)) {
                    throw new IllegalArgumentException("prediction log " + path + " has no column '" + col + "'");
                }
            }
            boolean hasId = header.contains(COL_ID);

            List<PredictionLogRow> rows = new ArrayList<>();
            int skipped = 0;
            for (CSVRecord rec : parser) {
                Double predicted = number(rec, COL_PREDICTED);
                if (predicted == null) {
                    skipped++;
                    continue;
                }
                rows.add(new PredictionLogRow(
                        hasId && rec.isSet(COL_ID) ? rec.get(COL_ID) : null,
                        rec.isSet(COL_TIMESTAMP) ? UtcTimestamps.parse(rec.get(COL_TIMESTAMP)).orElse(null) : null,
                        predicted,
                        number(rec, COL_REAL)
                ));
            }

            if (skipped > 0) {
                log.warn("🧾 Prediction log {}: skipped {} rows without predicted_price", path, skipped);
            }
            return rows;

        } catch (IOException e) {
            throw new UncheckedIOException("cannot read prediction log " + path, e);
        }
    }

    private static Double number(CSVRecord rec, String col) {
        if (!rec.isSet(col)) return null;
        String raw = rec.get(col);
        if (raw == null || MISSING.contains(raw.trim().toLowerCase(Locale.ROOT))) return null;
        try {
            double v = Double.parseDouble(raw.trim());
            return Double.isFinite(v) ? v : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
