package com.fincube.fraud.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Decision proposed by the reasoning oracle, or by fallback voting when the
 * oracle is unavailable. Guardrails are applied afterwards.
 */
@Value
@Builder(toBuilder = true)
public class TentativeDecision {
    FraudLabel label;
    String reasoning;
    double confidence;
    List<String> edgeCases;
    List<String> riskFactors;
    boolean fallback;

    public List<String> getEdgeCases() {
        return edgeCases == null ? List.of() : edgeCases;
    }

    public List<String> getRiskFactors() {
        return riskFactors == null ? List.of() : riskFactors;
    }
}
