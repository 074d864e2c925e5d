package com.fincube.fraud.engine;

import com.fincube.fraud.config.FraudScoringConfig;
import com.fincube.fraud.model.FraudLabel;
import com.fincube.fraud.model.NeighborAnalysis;
import com.fincube.fraud.model.NeighborMatch;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns labeled nearest neighbors into a fraud probability and a confidence.
 *
 * Probability is inverse-distance weighted, so closer neighbors dominate.
 * Confidence averages a proximity term 1/(1+avgDistance) with the majority share.
 */
@Component
public class NeighborEvidenceModel {

    static final double EPSILON = 1e-6;

    private final FraudScoringConfig config;

    public NeighborEvidenceModel(FraudScoringConfig config) {
        this.config = config;
    }

    public NeighborAnalysis analyze(List<NeighborMatch> neighbors) {
        if (neighbors == null || neighbors.isEmpty()) {
            return noEvidence();
        }

        int fraudCount = 0;
        double weightSum = 0.0;
        double fraudWeight = 0.0;
        double distanceSum = 0.0;

        for (NeighborMatch neighbor : neighbors) {
            double distance = neighbor.getDistance();
            double weight = 1.0 / (distance + EPSILON);
            weightSum += weight;
            distanceSum += distance;
            if (neighbor.isFraud()) {
                fraudCount++;
                fraudWeight += weight;
            }
        }

        int total = neighbors.size();
        int nonFraudCount = total - fraudCount;
        double avgDistance = Numbers.finiteOrZero(distanceSum / total);

        double distanceConfidence = 1.0 / (1.0 + avgDistance);
        double agreement = (double) Math.max(fraudCount, nonFraudCount) / total;

        return NeighborAnalysis.builder()
                .fraudProbability(Numbers.clamp01(Numbers.ratio(fraudWeight, weightSum)))
                .simpleFraudProbability(Numbers.clamp01((double) fraudCount / total))
                .fraudCount(fraudCount)
                .nonFraudCount(nonFraudCount)
                .totalCount(total)
                .avgDistance(avgDistance)
                .confidence(Numbers.clamp01((distanceConfidence + agreement) / 2.0))
                .build();
    }

    /**
     * Neighbor-only decision with the configured threshold and confidence floor.
     */
    public FraudLabel classify(NeighborAnalysis analysis) {
        return classify(analysis.getFraudProbability(), analysis.getConfidence(),
                config.getDecisionThreshold());
    }

    /**
     * Below the confidence floor the answer is always UNDECIDED. Otherwise
     * p >= threshold is FRAUD, p < 1 - threshold is NOT_FRAUD and the band
     * in between is UNDECIDED.
     */
    public FraudLabel classify(double fraudProbability, double confidence, double threshold) {
        if (confidence < config.getConfidenceFloor()) {
            return FraudLabel.UNDECIDED;
        }
        if (fraudProbability >= threshold) {
            return FraudLabel.FRAUD;
        }
        if (fraudProbability < 1.0 - threshold) {
            return FraudLabel.NOT_FRAUD;
        }
        return FraudLabel.UNDECIDED;
    }

    public static NeighborAnalysis noEvidence() {
        return NeighborAnalysis.builder()
                .fraudProbability(0.5)
                .simpleFraudProbability(0.0)
                .fraudCount(0)
                .nonFraudCount(0)
                .totalCount(0)
                .avgDistance(0.0)
                .confidence(0.0)
                .build();
    }
}
