package com.fincube.fraud.engine;

import com.fincube.fraud.config.FraudScoringConfig;
import com.fincube.fraud.model.Archetype;
import com.fincube.fraud.model.NeighborAnalysis;
import com.fincube.fraud.model.PatternDimension;
import com.fincube.fraud.model.PatternReport;
import com.fincube.fraud.model.PatternTag;
import com.fincube.fraud.model.QualityTier;
import com.fincube.fraud.model.ValidationReport;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Checks whether neighbor evidence and behavioral patterns tell the same story.
 *
 * Score = 0.3 alignment + 0.2 confidence floor + 0.3 multiple signals
 *       + 0.2 (1 - |fraudProbability - behavioralRisk|)
 */
@Component
public class CrossValidator {

    // Token risk does not count toward the multiple-signal check.
    static final List<PatternDimension> SIGNAL_DIMENSIONS = List.of(
            PatternDimension.TEMPORAL, PatternDimension.VALUE,
            PatternDimension.NETWORK, PatternDimension.BEHAVIORAL);

    private final FraudScoringConfig config;

    public CrossValidator(FraudScoringConfig config) {
        this.config = config;
    }

    public ValidationReport validate(NeighborAnalysis neighbors, PatternReport patterns) {
        FraudScoringConfig.Validation v = config.getValidation();
        double fraudProbability = neighbors.getFraudProbability();
        double behavioralRisk = patterns.getBehavioralRisk();

        boolean alignment = (fraudProbability > v.getAlignmentHighProbability() && behavioralRisk > v.getAlignmentHighRisk())
                || (fraudProbability < v.getAlignmentLowProbability() && behavioralRisk < v.getAlignmentLowRisk());

        boolean confidenceMet = neighbors.getConfidence() >= v.getConfidenceFloor();

        int highRiskDimensions = (int) SIGNAL_DIMENSIONS.stream()
                .filter(d -> patterns.riskLevel(d) > v.getHighRiskLevel())
                .count();
        boolean multipleSignals = highRiskDimensions >= v.getMinHighRiskDimensions();

        Set<PatternTag> tags = patterns.allTags();
        Set<Archetype> archetypes = EnumSet.noneOf(Archetype.class);
        for (Archetype archetype : Archetype.values()) {
            if (archetype.matches(tags)) {
                archetypes.add(archetype);
            }
        }

        double agreement = Numbers.clamp01(1.0 - Math.abs(fraudProbability - behavioralRisk));
        double score = Numbers.clamp01(
                v.getAlignmentWeight() * (alignment ? 1 : 0)
                        + v.getConfidenceWeight() * (confidenceMet ? 1 : 0)
                        + v.getMultipleSignalWeight() * (multipleSignals ? 1 : 0)
                        + v.getAgreementWeight() * agreement);

        return ValidationReport.builder()
                .neighborPatternAlignment(alignment)
                .confidenceThresholdMet(confidenceMet)
                .multipleRiskSignals(multipleSignals)
                .highRiskDimensionCount(highRiskDimensions)
                .agreementScore(agreement)
                .archetypes(archetypes)
                .overallValidationScore(score)
                .qualityTier(QualityTier.fromScore(score))
                .build();
    }
}
