package com.chicu.homeprice.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Тело POST /predict: 13 фич Boston Housing, имена как в датасете.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictRequest {

    @NotNull @JsonProperty("CRIM")
    private Double crim;

    @NotNull @JsonProperty("ZN")
    private Double zn;

    @NotNull @JsonProperty("INDUS")
    private Double indus;

    /** 0 / 1: участок у реки Чарльз. Double, чтобы 0.7 не округлялось молча до 0 */
    @NotNull @Min(0) @Max(1) @Digits(integer = 1, fraction = 0) @JsonProperty("CHAS")
    private Double chas;

    @NotNull @JsonProperty("NOX")
    private Double nox;

    @NotNull @JsonProperty("RM")
    private Double rm;

    @NotNull @JsonProperty("AGE")
    private Double age;

    @NotNull @JsonProperty("DIS")
    private Double dis;

    @NotNull @JsonProperty("RAD")
    private Double rad;

    @NotNull @JsonProperty("TAX")
    private Double tax;

    @NotNull @JsonProperty("PTRATIO")
    private Double ptratio;

    @NotNull @JsonProperty("B")
    private Double b;

    @NotNull @JsonProperty("LSTAT")
    private Double lstat;

    public Map<String, Double> toFeatures() {
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
