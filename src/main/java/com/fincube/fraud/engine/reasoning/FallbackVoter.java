package com.fincube.fraud.engine.reasoning;

import com.fincube.fraud.config.FraudScoringConfig;
import com.fincube.fraud.model.Archetype;
import com.fincube.fraud.model.FraudLabel;
import com.fincube.fraud.model.NeighborAnalysis;
import com.fincube.fraud.model.PatternReport;
import com.fincube.fraud.model.PatternTag;
import com.fincube.fraud.model.TentativeDecision;
import com.fincube.fraud.model.ValidationReport;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Deterministic decision used when the reasoning oracle is disabled, fails or
 * answers with something unparseable.
 *
 * Votes:
 *   neighbor probability   > 0.6 : +2 fraud,  < 0.4  : +2 legitimate
 *   behavioral risk        > 0.6 : +2 fraud,  < 0.35 : +2 legitimate
 *   mixer or wash-trading archetype : +1 fraud
 *   alignment check true   : +1 to the side the neighbor probability favors
 * Three votes on a side decide it, fraud first, with confidence min(0.7, votes / 5).
 */
@Component
public class FallbackVoter {

    private final FraudScoringConfig config;

    public FallbackVoter(FraudScoringConfig config) {
        this.config = config;
    }

    public TentativeDecision vote(NeighborAnalysis neighbors, PatternReport patterns,
                                  ValidationReport validation, List<String> edgeCases, String cause) {
        FraudScoringConfig.Fallback f = config.getFallback();
        double fraudProbability = neighbors.getFraudProbability();
        double behavioralRisk = patterns.getBehavioralRisk();

        int fraudVotes = 0;
        int legitVotes = 0;

        if (fraudProbability > f.getFraudProbabilityHigh()) {
            fraudVotes += f.getStrongVotes();
        } else if (fraudProbability < f.getFraudProbabilityLow()) {
            legitVotes += f.getStrongVotes();
        }

        if (behavioralRisk > f.getBehavioralRiskHigh()) {
            fraudVotes += f.getStrongVotes();
        } else if (behavioralRisk < f.getBehavioralRiskLow()) {
            legitVotes += f.getStrongVotes();
        }

        if (validation.hasArchetype(Archetype.MIXER) || validation.hasArchetype(Archetype.WASH_TRADING)) {
            fraudVotes += f.getArchetypeVotes();
        }

        if (validation.isNeighborPatternAlignment()) {
            if (fraudProbability > 0.5) {
                fraudVotes += f.getAlignmentVotes();
            } else {
                legitVotes += f.getAlignmentVotes();
            }
        }

        FraudLabel label;
        double confidence;
        if (fraudVotes >= f.getDecisiveVotes()) {
            label = FraudLabel.FRAUD;
            confidence = Math.min(f.getMaxConfidence(), fraudVotes / f.getVoteScale());
        } else if (legitVotes >= f.getDecisiveVotes()) {
            label = FraudLabel.NOT_FRAUD;
            confidence = Math.min(f.getMaxConfidence(), legitVotes / f.getVoteScale());
        } else {
            label = FraudLabel.UNDECIDED;
            confidence = f.getUndecidedConfidence();
        }

        String reasoning = String.format(
                "Reasoning oracle unavailable (%s). Neighbor fraud probability %.2f, behavioral risk %.2f. "
                        + "[Fallback decision based on %d fraud signals vs %d legitimate signals]",
                cause, fraudProbability, behavioralRisk, fraudVotes, legitVotes);

        return TentativeDecision.builder()
                .label(label)
                .confidence(confidence)
                .reasoning(reasoning)
                .edgeCases(edgeCases == null ? List.of() : List.copyOf(edgeCases))
                .riskFactors(riskFactors(patterns))
                .fallback(true)
                .build();
    }

    private static List<String> riskFactors(PatternReport patterns) {
        return patterns.allTags().stream()
                .map(PatternTag::getDescription)
                .collect(Collectors.toList());
    }
}
