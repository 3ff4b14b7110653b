package com.chicu.homeprice.ml.features;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class FeatureSchema {

    private final String[] names;
    private final String schemaHash;

    public FeatureSchema(String[] names) {
        if (names == null || names.length == 0) {
            throw new IllegalArgumentException("schema names are empty");
        }
        this.names = names.clone();
        this.schemaHash = sha256(String.join("|", this.names));
    }

    public FeatureSchema(List<String> names) {
        this(names != null ? names.toArray(new String[0]) : null);
    }

    public String[] featureNames() {
        return names.clone();
    }

    public List<String> featureList() {
        return List.of(names);
    }

    public int size() {
        return names.length;
    }

    public String schemaHash() {
        return schemaHash;
    }

    /**
     * Имена фич, которых нет в map (или значение null / не число).
     */
    public List<String> missing(Map<String, Double> features) {
        List<String> out = new ArrayList<>();
        for (String k : names) {
            Double v = features != null ? features.get(k) : null;
            if (v == null || !Double.isFinite(v)) out.add(k);
        }
        return out;
    }

    /**
     * Вектор в порядке схемы. Отсутствующие значения -> NaN,
     * их закрывает импутация внутри модели.
     */
    public double[] toVector(Map<String, Double> features) {
        double[] x = new double[names.length];
        for (int i = 0; i < names.length; i++) {
            Double v = features != null ? features.get(names[i]) : null;
            x[i] = (v != null && Double.isFinite(v)) ? v : Double.NaN;
        }
        return x;
    }

    public Map<String, Double> toMap(double[] x) {
        if (x == null || x.length != names.length) {
            throw new IllegalArgumentException("vector size mismatch: expected=" + names.length
                    + " got=" + (x == null ? "null" : x.length));
        }
        Map<String, Double> out = new LinkedHashMap<>();
        for (int i = 0; i < names.length; i++) {
            out.put(names[i], x[i]);
        }
        return out;
    }

    private static String sha256(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(s.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(dig);
        } catch (Exception e) {
            throw new IllegalStateException("sha256 error: " + e.getMessage(), e);
        }
    }
}
