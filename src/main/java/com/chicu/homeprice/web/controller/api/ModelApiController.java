package com.chicu.homeprice.web.controller.api;

import com.chicu.homeprice.ml.registry.ArtifactStore;
import com.chicu.homeprice.ml.registry.LoadedModel;
import com.chicu.homeprice.ml.serving.ModelHandle;
import com.chicu.homeprice.web.dto.ApiResponse;
import com.chicu.homeprice.web.dto.RunInfoResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RestController
@RequiredArgsConstructor
public class ModelApiController {

    private final ModelHandle modelHandle;
    private final ArtifactStore artifactStore;

    /**
     * Liveness: процесс жив, модель не важна.
     */
    @GetMapping(value = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public ApiResponse healthz() {
        return ApiResponse.ok("API is running");
    }

    /**
     * Readiness: есть загруженная модель.
     */
    @GetMapping(value = "/readyz", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> readyz() {
        Map<String, Object> body = new LinkedHashMap<>();
        Optional<LoadedModel> m = modelHandle.peek();
        if (m.isPresent()) {
            body.put("ready", true);
            body.put("run_id", m.get().runId());
            return ResponseEntity.ok(body);
        }
        body.put("ready", false);
        body.put("reason", modelHandle.lastError());
        return ResponseEntity.status(503).body(body);
    }

    /**
     * Запуск, который сейчас отвечает на /predict.
     */
    @GetMapping(value = "/version", produces = MediaType.APPLICATION_JSON_VALUE)
    public RunInfoResponse version() {
        return RunInfoResponse.of(modelHandle.current().run());
    }

    @GetMapping(value = "/runs", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<RunInfoResponse> runs() {
        return artifactStore.listRuns().stream()
                .map(RunInfoResponse::of)
                .toList();
    }

    @PostMapping(value = "/model/reload", produces = MediaType.APPLICATION_JSON_VALUE)
    public RunInfoResponse reload() {
        LoadedModel loaded = modelHandle.reload();
        log.info("🔄 Model reloaded via API runId={}", loaded.runId());
        return RunInfoResponse.of(loaded.run());
    }
}
