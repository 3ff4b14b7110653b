package com.chicu.homeprice.web.controller.api;

import com.chicu.homeprice.ml.predictionlog.PredictionNotFoundException;
import com.chicu.homeprice.ml.registry.RegistryException;
import com.chicu.homeprice.ml.serving.FeatureValidationException;
import com.chicu.homeprice.ml.serving.ModelUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiErrorHandler {

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentNotValidException.class,
            FeatureValidationException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e, HttpServletRequest req) {
        log.warn("400 Bad Request at {}: {}", safePath(req), e.toString());
        return build(400, "error", e, req);
    }

    @ExceptionHandler(PredictionNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(PredictionNotFoundException e, HttpServletRequest req) {
        log.info("404 at {}: {}", safePath(req), safeMsg(e));
        return build(404, "not_found", e, req);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNoResource(NoResourceFoundException e, HttpServletRequest req) {
        return build(404, "error", e, req);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleMethodNotAllowed(HttpRequestMethodNotSupportedException e,
                                                                      HttpServletRequest req) {
        log.warn("405 Method Not Allowed at {}: {}", safePath(req), e.getMethod());
        return build(405, "error", e, req);
    }

    /**
     * Модели нет или реестр битый: сервис "not ready", а не упавший.
     */
    @ExceptionHandler({ModelUnavailableException.class, RegistryException.class})
    public ResponseEntity<Map<String, Object>> handleUnavailable(RuntimeException e, HttpServletRequest req) {
        log.warn("503 at {}: {}", safePath(req), safeMsg(e));
        return build(503, "error", e, req);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handle(Exception e, HttpServletRequest req) {
        // общий неожиданный 500
        log.error("500 at {}: {}", safePath(req), safeMsg(e), e);
        return build(500, "error", e, req);
    }

    // ---------- helpers ----------

    private ResponseEntity<Map<String, Object>> build(int code, String status, Exception e, HttpServletRequest req) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status);
        body.put("code", code);
        body.put("error", e.getClass().getSimpleName());
        body.put("message", safeMsg(e));
        body.put("path", safePath(req));
        body.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.status(code).body(body);
    }

    private String safeMsg(Throwable e) {
        String m = (e != null ? e.getMessage() : null);
        return (m != null && !m.isBlank()) ? m : (e != null ? e.getClass().getSimpleName() : "Error");
    }

    private String safePath(HttpServletRequest req) {
        return req != null ? req.getRequestURI() : "/";
    }
}
