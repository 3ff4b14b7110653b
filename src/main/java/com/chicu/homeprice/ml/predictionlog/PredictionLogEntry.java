package com.chicu.homeprice.ml.predictionlog;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "prediction_log",
        indexes = {
                @Index(name = "ix_prediction_log_predicted_at", columnList = "predicted_at")
        }
)
public class PredictionLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "predicted_at", nullable = false)
    private Instant timestamp;

    // ==========================
    // 13 ФИЧ (фиксированная схема)
    // ==========================
    @Column(name = "crim", nullable = false)
    private Double crim;

    @Column(name = "zn", nullable = false)
    private Double zn;

    @Column(name = "indus", nullable = false)
    private Double indus;

    @Column(name = "chas", nullable = false)
    private Double chas;

    @Column(name = "nox", nullable = false)
    private Double nox;

    @Column(name = "rm", nullable = false)
    private Double rm;

    @Column(name = "age", nullable = false)
    private Double age;

    @Column(name = "dis", nullable = false)
    private Double dis;

    @Column(name = "rad", nullable = false)
    private Double rad;

    @Column(name = "tax", nullable = false)
    private Double tax;

    @Column(name = "ptratio", nullable = false)
    private Double ptratio;

    @Column(name = "b", nullable = false)
    private Double b;

    @Column(name = "lstat", nullable = false)
    private Double lstat;

    // ==========================
    // ПРОГНОЗ / ФАКТ
    // ==========================
    @Column(name = "predicted_price", nullable = false)
    private Double predictedPrice;

    /**
     * null, пока не пришёл feedback.
     */
    @Column(name = "real_price")
    private Double realPrice;

    /**
     * Какой запуск отдал прогноз (только для диагностики, оценка дрейфа его не использует).
     */
    @Column(name = "run_id", length = 128)
    private String runId;

    public static PredictionLogEntry of(Map<String, Double> f, double predictedPrice, String runId, Instant at) {
        return PredictionLogEntry.builder()
                .timestamp(at)
                .crim(f.get("CRIM"))
                .zn(f.get("ZN"))
                .indus(f.get("INDUS"))
                .chas(f.get("CHAS"))
                .nox(f.get("NOX"))
                .rm(f.get("RM"))
                .age(f.get("AGE"))
                .dis(f.get("DIS"))
                .rad(f.get("RAD"))
                .tax(f.get("TAX"))
                .ptratio(f.get("PTRATIO"))
                .b(f.get("B"))
                .lstat(f.get("LSTAT"))
                .predictedPrice(predictedPrice)
                .runId(runId)
                .build();
    }

    public Map<String, Double> features() {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("CRIM", crim);
        m.put("ZN", zn);
        m.put("INDUS", indus);
        m.put("CHAS", chas);
        m.put("NOX", nox);
        m.put("RM", rm);
        m.put("AGE", age);
        m.put("DIS", dis);
        m.put("RAD", rad);
        m.put("TAX", tax);
        m.put("PTRATIO", ptratio);
        m.put("B", b);
        m.put("LSTAT", lstat);
        return m;
    }
}
