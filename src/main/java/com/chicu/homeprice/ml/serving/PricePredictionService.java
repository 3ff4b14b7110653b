package com.chicu.homeprice.ml.serving;

import com.chicu.homeprice.ml.features.FeatureSchema;
import com.chicu.homeprice.ml.features.HousingFeatures;
import com.chicu.homeprice.ml.predictionlog.PredictionLogEntry;
import com.chicu.homeprice.ml.predictionlog.PredictionLogService;
import com.chicu.homeprice.ml.registry.LoadedModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;

/**
 * Прогноз цены активной моделью + запись в журнал предсказаний.
 * Модель берётся из {@link ModelHandle} и сама здесь не перезагружается.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PricePredictionService {

    private final ModelHandle modelHandle;
    private final PredictionLogService predictionLog;
    private final ServingProperties props;

    public PredictionResult predict(Map<String, Double> features) {
        LoadedModel loaded = modelHandle.current();

        FeatureSchema schema = HousingFeatures.SCHEMA;
        List<String> invalid = schema.missing(features);
        if (!invalid.isEmpty()) {
            throw new FeatureValidationException(invalid);
        }

        double raw = loaded.model().predict(vectorFor(loaded, features));
        if (!Double.isFinite(raw)) {
            throw new IllegalStateException("model " + loaded.runId() + " returned a non-finite price: " + raw);
        }
        double price = round(raw, props.getPriceScale());

        PredictionLogEntry entry = predictionLog.append(schema.toMap(schema.toVector(features)), price, loaded.runId());

        log.debug("🏠 PREDICT id={} price={} runId={}", entry.getId(), price, loaded.runId());

        return PredictionResult.builder()
                .id(entry.getId())
                .predictedPrice(price)
                .runId(loaded.runId())
                .timestamp(entry.getTimestamp())
                .build();
    }

    // порядок фич берём у модели, а не у схемы сервиса
    private static double[] vectorFor(LoadedModel loaded, Map<String, Double> features) {
        return new FeatureSchema(loaded.model().featureNames()).toVector(features);
    }

    private static double round(double v, int scale) {
        return BigDecimal.valueOf(v).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
