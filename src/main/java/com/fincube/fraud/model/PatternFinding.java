package com.fincube.fraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

@Value
@Builder
@Jacksonized
@Schema(description = "Output of one pattern detector")
public class PatternFinding {

    @Schema(description = "Detector dimension", example = "VALUE")
    PatternDimension dimension;

    @Schema(description = "Indicators triggered by the detector")
    @Singular
    Set<PatternTag> tags;

    @Schema(description = "Sum of triggered indicator weights, clamped to 0-1", example = "0.7")
    double riskLevel;

    @Schema(description = "Intermediate measurements (ratios, counts) for explanation")
    @Singular
    Map<String, Double> metrics;

    public static PatternFinding empty(PatternDimension dimension) {
        return PatternFinding.builder().dimension(dimension).riskLevel(0.0).build();
    }

    public Set<PatternTag> getTags() {
        return tags.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(tags));
    }

    public boolean has(PatternTag tag) {
        return tags.contains(tag);
    }
}
