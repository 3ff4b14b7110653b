package com.chicu.homeprice.ml.predictionlog;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class PredictionLogService {

    private final PredictionLogRepository repo;
    private final Clock clock;

    /**
     * Пишет прогноз в журнал. real_price пустой до прихода feedback.
     * Каждая запись вставляется отдельной строкой, параллельные append не мешают друг другу.
     *
     * @return сохранённая запись с присвоенным id
     */
    @Transactional
    public PredictionLogEntry append(Map<String, Double> features, double predictedPrice, String runId) {
        Objects.requireNonNull(features, "features");

        PredictionLogEntry e = PredictionLogEntry.of(features, predictedPrice, runId, clock.instant());
        PredictionLogEntry saved = repo.save(e);

        log.debug("🧾 Prediction logged id={} price={} runId={}", saved.getId(), predictedPrice, runId);
        return saved;
    }

    /**
     * Проставляет real_price ровно одной записи.
     * Повтор с тем же значением даёт тот же результат.
     *
     * @return false, если id не найден (журнал не меняется)
     */
    public boolean updateRealPrice(UUID id, double realPrice) {
        Objects.requireNonNull(id, "id");
        if (!Double.isFinite(realPrice)) {
            throw new IllegalArgumentException("real_price must be a finite number, got " + realPrice);
        }

        int updated = repo.updateRealPrice(id, realPrice);
        if (updated == 0) {
            log.info("🧾 Feedback for unknown id={}", id);
            return false;
        }

        log.info("🧾 Feedback stored id={} real_price={}", id, realPrice);
        return true;
    }

    /**
     * Вариант для внешнего ввода: id приходит строкой, кривой UUID = "не найден".
     */
    public boolean updateRealPrice(String rawId, double realPrice) {
        Optional<UUID> id = parseId(rawId);
        if (id.isEmpty()) {
            log.info("🧾 Feedback with malformed id={}", rawId);
            return false;
        }
        return updateRealPrice(id.get(), realPrice);
    }

    @Transactional(readOnly = true)
    public List<PredictionLogEntry> readAll() {
        return repo.findAllByOrderByTimestampAsc();
    }

    @Transactional(readOnly = true)
    public List<PredictionLogRow> readRows() {
        return repo.findAllByOrderByTimestampAsc().stream()
                .map(PredictionLogRow::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<PredictionLogEntry> find(UUID id) {
        return repo.findById(id);
    }

    private static Optional<UUID> parseId(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(UUID.fromString(raw.trim()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
