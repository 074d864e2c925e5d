package com.fincube.fraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * All detector findings for one account plus the aggregated behavioral risk.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Pattern detector findings and aggregated behavioral risk")
public class PatternReport {

    @Schema(description = "Finding per detector dimension")
    Map<PatternDimension, PatternFinding> findings;

    @Schema(description = "Weighted behavioral risk score (0-1)", example = "0.42")
    double behavioralRisk;

    public Map<PatternDimension, PatternFinding> getFindings() {
        return findings == null ? Collections.emptyMap() : Collections.unmodifiableMap(new EnumMap<>(findings));
    }

    public PatternFinding finding(PatternDimension dimension) {
        PatternFinding finding = findings == null ? null : findings.get(dimension);
        return finding != null ? finding : PatternFinding.empty(dimension);
    }

    public double riskLevel(PatternDimension dimension) {
        return finding(dimension).getRiskLevel();
    }

    public Set<PatternTag> allTags() {
        Set<PatternTag> tags = EnumSet.noneOf(PatternTag.class);
        if (findings != null) {
            findings.values().forEach(f -> tags.addAll(f.getTags()));
        }
        return tags;
    }
}
