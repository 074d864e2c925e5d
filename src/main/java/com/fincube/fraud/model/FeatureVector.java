package com.fincube.fraud.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed-length feature vector in canonical feature order.
 * A raw vector has scalerVersion 0; a normalized copy records the version of
 * the scaler that produced it.
 */
public final class FeatureVector {

    public static final long RAW = 0L;

    private final List<String> names;
    private final double[] values;
    private final long scalerVersion;

    public FeatureVector(List<String> names, double[] values, long scalerVersion) {
        if (names.size() != values.length) {
            throw new IllegalArgumentException("Feature name count " + names.size()
                    + " does not match value count " + values.length);
        }
        this.names = List.copyOf(names);
        this.values = values.clone();
        this.scalerVersion = scalerVersion;
    }

    public int size() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public double[] toArray() {
        return values.clone();
    }

    public List<String> getNames() {
        return names;
    }

    public long getScalerVersion() {
        return scalerVersion;
    }

    public boolean isNormalized() {
        return scalerVersion != RAW;
    }

    /**
     * Named view of the vector. Repeated names keep their first value.
     */
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.putIfAbsent(names.get(i), values[i]);
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public String toString() {
        return "FeatureVector{size=" + values.length + ", scalerVersion=" + scalerVersion
                + ", values=" + Arrays.toString(values) + "}";
    }
}
