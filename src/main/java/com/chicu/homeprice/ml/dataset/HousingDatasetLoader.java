package com.chicu.homeprice.ml.dataset;

import com.chicu.homeprice.ml.features.FeatureSchema;
import com.chicu.homeprice.ml.features.HousingFeatures;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * HousingDatasetLoader
 * ====================
 * Читает CSV с заголовком и собирает датасет для обучения:
 * - проверяет, что есть все 13 фич и MEDV (иначе SchemaException со списком);
 * - пустые / NA / NaN / null в фичах -> NaN (закрывается импутацией медианой);
 * - целевая переменная обязана быть числом.
 */
@Slf4j
@Service
public class HousingDatasetLoader {

    private static final Set<String> MISSING_TOKENS = Set.of("", "na", "nan", "null", "none");

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true) // pandas пишет пустое имя для индекса
            .build();

    private final FeatureSchema schema;
    private final String target;

    public HousingDatasetLoader() {
        this(HousingFeatures.SCHEMA, HousingFeatures.TARGET);
    }

    public HousingDatasetLoader(FeatureSchema schema, String target) {
        this.schema = schema;
        this.target = target;
    }

    public HousingDataset load(Path csvPath) {
        if (csvPath == null) throw new IllegalArgumentException("csvPath=null");
        if (!Files.isRegularFile(csvPath)) {
            throw new DatasetException("dataset file not found: " + csvPath);
        }

        try (Reader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(reader)) {
            return build(csvPath.getFileName().toString(), parser);
        } catch (IOException e) {
            throw new DatasetException("failed to read dataset " + csvPath + ": " + e.getMessage(), e);
        }
    }

    private HousingDataset build(String datasetId, CSVParser parser) {
        Map<String, Integer> header = parser.getHeaderMap();
        requireColumns(header);

        String[] names = schema.featureNames();
        List<double[]> rows = new ArrayList<>();
        List<Double> targets = new ArrayList<>();

        for (CSVRecord rec : parser) {
            long line = rec.getRecordNumber() + 1; // +1 за заголовок
            double[] x = new double[names.length];
            for (int i = 0; i < names.length; i++) {
                x[i] = parseFeature(cell(rec, names[i], line), names[i], line);
            }
            double yv = parseTarget(cell(rec, target, line), line);
            rows.add(x);
            targets.add(yv);
        }

        if (rows.isEmpty()) {
            throw new DatasetException("dataset is empty: " + datasetId);
        }

        int n = rows.size();
        double[][] X = rows.toArray(new double[0][]);
        double[] y = new double[n];
        for (int i = 0; i < n; i++) y[i] = targets.get(i);

        log.info("📦 Dataset loaded: id={} samples={} features={}", datasetId, n, names.length);

        return new HousingDataset(datasetId, schema.featureList(), X, y, n, names.length);
    }

    private void requireColumns(Map<String, Integer> header) {
        List<String> missing = new ArrayList<>();
        for (String f : schema.featureNames()) {
            if (header == null || !header.containsKey(f)) missing.add(f);
        }
        if (header == null || !header.containsKey(target)) missing.add(target);

        if (!missing.isEmpty()) {
            log.warn("📦 Dataset schema FAIL missing={}", missing);
            throw new SchemaException(missing);
        }
    }

    private static double parseFeature(String raw, String column, long line) {
        if (isMissing(raw)) return Double.NaN;
        try {
            double v = Double.parseDouble(raw.trim());
            return Double.isFinite(v) ? v : Double.NaN;
        } catch (NumberFormatException e) {
            throw new DatasetException("non-numeric value '" + raw + "' in column " + column + " at line " + line, e);
        }
    }

    private static String cell(CSVRecord rec, String column, long line) {
        try {
            return rec.get(column);
        } catch (IllegalArgumentException e) {
            throw new DatasetException("row at line " + line + " has no value for column " + column, e);
        }
    }

    private double parseTarget(String raw, long line) {
        if (isMissing(raw)) {
            throw new DatasetException("missing target " + target + " at line " + line);
        }
        try {
            double v = Double.parseDouble(raw.trim());
            if (!Double.isFinite(v)) throw new NumberFormatException("not finite");
            return v;
        } catch (NumberFormatException e) {
            throw new DatasetException("non-numeric target '" + raw + "' at line " + line, e);
        }
    }

    private static boolean isMissing(String raw) {
        return raw == null || MISSING_TOKENS.contains(raw.trim().toLowerCase(Locale.ROOT));
    }
}
