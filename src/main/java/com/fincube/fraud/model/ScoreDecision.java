package com.fincube.fraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Final fused fraud classification")
public class ScoreDecision {

    @Schema(description = "Final label", example = "Fraud")
    FraudLabel label;

    @Schema(description = "Confidence in the label (0-1)", example = "0.72")
    double confidence;

    @Schema(description = "Explanation, including any guardrail adjustments")
    String reasoning;

    @Schema(description = "Specific risk factors, most important first")
    List<String> riskFactors;

    @Schema(description = "Edge cases and anomalies noted during analysis")
    List<String> edgeCases;

    @Schema(description = "Aggregated behavioral risk (0-1)", example = "0.41")
    double behavioralScore;

    @Schema(description = "Cross-signal validation report")
    ValidationReport validation;

    @Schema(description = "True when the oracle was unavailable and fallback voting decided", example = "false")
    boolean fallbackUsed;

    @Schema(description = "Guardrail rules that overrode the tentative decision")
    List<String> overrides;

    public List<String> getRiskFactors() {
        return riskFactors == null ? List.of() : riskFactors;
    }

    public List<String> getEdgeCases() {
        return edgeCases == null ? List.of() : edgeCases;
    }

    public List<String> getOverrides() {
        return overrides == null ? List.of() : overrides;
    }
}
