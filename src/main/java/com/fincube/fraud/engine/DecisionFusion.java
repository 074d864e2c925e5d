package com.fincube.fraud.engine;

import com.fincube.fraud.config.FraudScoringConfig;
import com.fincube.fraud.config.MetricsConfig;
import com.fincube.fraud.model.FraudLabel;
import com.fincube.fraud.model.NeighborAnalysis;
import com.fincube.fraud.model.ScoreDecision;
import com.fincube.fraud.model.TentativeDecision;
import com.fincube.fraud.model.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies guardrails to the tentative decision. Guardrails only ever move a
 * decision to UNDECIDED and cap its confidence; the first one that fires wins.
 *
 * Rules, in order:
 *   1. neighbor confidence below the evidence floor
 *   2. FRAUD with weak neighbor probability and low behavioral risk
 *   3. NOT_FRAUD contradicted by high neighbor probability and high behavioral risk
 */
@Component
public class DecisionFusion {

    private static final Logger log = LoggerFactory.getLogger(DecisionFusion.class);

    public enum Guardrail {
        INSUFFICIENT_EVIDENCE("[Overridden to Undecided due to very low neighbor confidence]"),
        UNSUPPORTED_FRAUD("[Adjusted to Undecided - weak fraud signals]"),
        CONTRADICTED_NOT_FRAUD("[Adjusted to Undecided - strong fraud signals present]");

        private final String note;

        Guardrail(String note) {
            this.note = note;
        }

        public String getNote() {
            return note;
        }
    }

    private final FraudScoringConfig config;
    private final MetricsConfig metricsConfig;

    public DecisionFusion(FraudScoringConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    public ScoreDecision fuse(TentativeDecision tentative, NeighborAnalysis neighbors,
                              double behavioralRisk, ValidationReport validation) {
        ScoreDecision decision = ScoreDecision.builder()
                .label(tentative.getLabel() != null ? tentative.getLabel() : FraudLabel.UNDECIDED)
                .confidence(tentative.getConfidence())
                .reasoning(tentative.getReasoning() != null ? tentative.getReasoning() : "")
                .riskFactors(List.copyOf(tentative.getRiskFactors()))
                .edgeCases(List.copyOf(tentative.getEdgeCases()))
                .fallbackUsed(tentative.isFallback())
                .overrides(List.of())
                .build();
        return fuse(decision, neighbors, behavioralRisk, validation);
    }

    /**
     * Re-applies the guardrails to an already fused decision. With the same
     * evidence the result equals the input.
     */
    public ScoreDecision fuse(ScoreDecision decision, NeighborAnalysis neighbors,
                              double behavioralRisk, ValidationReport validation) {
        FraudScoringConfig.Guardrails g = config.getGuardrails();
        double fraudProbability = neighbors.getFraudProbability();
        double neighborConfidence = neighbors.getConfidence();
        FraudLabel label = decision.getLabel() != null ? decision.getLabel() : FraudLabel.UNDECIDED;

        Guardrail fired = null;
        double cap = 1.0;

        if (neighborConfidence < g.getMinNeighborConfidence()) {
            if (label != FraudLabel.UNDECIDED) {
                fired = Guardrail.INSUFFICIENT_EVIDENCE;
                cap = g.getInsufficientEvidenceConfidenceCap();
            }
        } else if (label == FraudLabel.FRAUD
                && fraudProbability < g.getFraudMaxProbability()
                && behavioralRisk < g.getFraudMaxRisk()
                && neighborConfidence > g.getFraudMinNeighborConfidence()) {
            fired = Guardrail.UNSUPPORTED_FRAUD;
            cap = g.getDowngradeConfidenceCap();
        } else if (label == FraudLabel.NOT_FRAUD
                && fraudProbability > g.getNotFraudMinProbability()
                && behavioralRisk > g.getNotFraudMinRisk()) {
            fired = Guardrail.CONTRADICTED_NOT_FRAUD;
            cap = g.getDowngradeConfidenceCap();
        }

        ScoreDecision.ScoreDecisionBuilder result = decision.toBuilder()
                .behavioralScore(Numbers.clamp01(behavioralRisk))
                .validation(validation);

        if (fired == null) {
            return result
                    .label(label)
                    .confidence(Numbers.clamp01(decision.getConfidence()))
                    .build();
        }

        log.info("Guardrail {} moved decision {} -> Undecided (p={}, risk={}, neighborConfidence={})",
                fired, label, fraudProbability, behavioralRisk, neighborConfidence);
        metricsConfig.recordGuardrailOverride(fired.name());

        List<String> overrides = new ArrayList<>(decision.getOverrides());
        overrides.add(fired.getNote());
        String reasoning = decision.getReasoning() == null || decision.getReasoning().isBlank()
                ? fired.getNote()
                : decision.getReasoning() + " " + fired.getNote();

        return result
                .label(FraudLabel.UNDECIDED)
                .confidence(Numbers.clamp01(Math.min(decision.getConfidence(), cap)))
                .reasoning(reasoning)
                .overrides(List.copyOf(overrides))
                .build();
    }
}
