package com.fincube.fraud.engine;

import com.fincube.fraud.config.FraudScoringConfig;
import com.fincube.fraud.model.PatternDimension;
import com.fincube.fraud.model.PatternFinding;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Weighted combination of per-dimension risk levels into one behavioral risk
 * score in [0, 1]. Missing dimensions count as 0.
 */
@Component
public class RiskAggregator {

    private final FraudScoringConfig config;

    public RiskAggregator(FraudScoringConfig config) {
        this.config = config;
    }

    public double aggregate(Map<PatternDimension, PatternFinding> findings) {
        double score = 0.0;
        for (PatternDimension dimension : PatternDimension.values()) {
            PatternFinding finding = findings.get(dimension);
            if (finding == null) continue;
            score += weight(dimension) * Numbers.clamp01(finding.getRiskLevel());
        }
        return Numbers.clamp01(score);
    }

    double weight(PatternDimension dimension) {
        FraudScoringConfig.Aggregation weights = config.getAggregation();
        switch (dimension) {
            case TEMPORAL:
                return weights.getTemporalWeight();
            case VALUE:
                return weights.getValueWeight();
            case NETWORK:
                return weights.getNetworkWeight();
            case TOKEN:
                return weights.getTokenWeight();
            case BEHAVIORAL:
                return weights.getBehavioralWeight();
            default:
                return 0.0;
        }
    }
}
