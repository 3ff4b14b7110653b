package com.chicu.homeprice.ml.serving;

import com.chicu.homeprice.ml.registry.ArtifactStore;
import com.chicu.homeprice.ml.registry.LoadedModel;
import com.chicu.homeprice.ml.registry.RegistryException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Явно владеемая ссылка на активную модель.
 * Чтение (predict) идёт параллельно без блокировок, перезагрузка только через {@link #reload()}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelHandle {

    private final ArtifactStore artifactStore;

    private final AtomicReference<LoadedModel> current = new AtomicReference<>();
    private volatile String lastError = "model was never loaded";

    /**
     * Загружает активный запуск из реестра.
     * При ошибке ручка очищается: сервис не должен угадывать, какую модель отдавать.
     */
    public LoadedModel reload() {
        try {
            LoadedModel loaded = artifactStore.loadCurrent();
            current.set(loaded);
            lastError = null;
            log.info("✅ Model loaded runId={} algorithm={}", loaded.runId(), loaded.model().algorithm());
            return loaded;
        } catch (RegistryException e) {
            current.set(null);
            lastError = e.getMessage();
            log.warn("⚠️ Model NOT loaded: {}", e.getMessage());
            throw e;
        }
    }

    public boolean isReady() {
        return current.get() != null;
    }

    public Optional<LoadedModel> peek() {
        return Optional.ofNullable(current.get());
    }

    public LoadedModel current() {
        LoadedModel m = current.get();
        if (m == null) {
            throw new ModelUnavailableException("model unavailable: " + lastError);
        }
        return m;
    }

    public String lastError() {
        return lastError;
    }
}
