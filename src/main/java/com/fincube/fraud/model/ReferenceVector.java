package com.fincube.fraud.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A normalized, labeled vector held by the similarity index.
 */
@Value
@Builder
@Jacksonized
public class ReferenceVector {
    String address;
    int label;
    double[] values;
    long scalerVersion;

    public double[] getValues() {
        return values.clone();
    }

    /**
     * Euclidean distance to the given vector.
     */
    public double distanceTo(double[] other) {
        double sum = 0.0;
        int n = Math.min(values.length, other.length);
        for (int i = 0; i < n; i++) {
            double d = values[i] - other[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }
}
