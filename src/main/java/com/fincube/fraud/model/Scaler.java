package com.fincube.fraud.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Frozen per-dimension normalization statistics fitted over a reference batch.
 * Instances are never mutated; refitting produces a new version.
 */
@Value
@Builder
@Jacksonized
@Schema(description = "Versioned standardization statistics for feature vectors")
public class Scaler {

    @Schema(description = "Monotonically increasing scaler version", example = "3")
    long version;

    @Schema(description = "Per-dimension mean")
    double[] means;

    @Schema(description = "Per-dimension population standard deviation")
    double[] stds;

    @Schema(description = "Number of vectors the scaler was fitted on", example = "9841")
    int sampleCount;

    @Schema(description = "Fit timestamp in epoch milliseconds", example = "1739886764000")
    long fittedAt;

    public double[] getMeans() {
        return means == null ? new double[0] : means.clone();
    }

    public double[] getStds() {
        return stds == null ? new double[0] : stds.clone();
    }

    @JsonIgnore
    public int getDimension() {
        return means == null ? 0 : means.length;
    }

    public double meanAt(int index) {
        return means[index];
    }

    public double stdAt(int index) {
        return stds[index];
    }
}
