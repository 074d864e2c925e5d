package com.fincube.fraud.engine;

import com.fincube.fraud.config.FraudScoringConfig;
import com.fincube.fraud.model.NeighborAnalysis;
import com.fincube.fraud.model.PatternDimension;
import com.fincube.fraud.model.PatternReport;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Produces human-readable notes about unusual account shapes. The notes are
 * passed to the reasoning oracle and surfaced on the decision.
 */
@Component
public class EdgeCaseDetector {

    private final FraudScoringConfig config;

    public EdgeCaseDetector(FraudScoringConfig config) {
        this.config = config;
    }

    public List<String> detect(Map<String, Double> features, NeighborAnalysis neighbors, PatternReport patterns) {
        FraudScoringConfig.EdgeCases e = config.getEdgeCases();
        List<String> notes = new ArrayList<>();

        double sentTx = feature(features, "Sent tnx");
        double receivedTx = feature(features, "Received Tnx");
        double balance = feature(features, "total ether balance");

        if (sentTx + receivedTx > e.getMixerMinTxns() && balance < e.getMixerMaxBalance()) {
            notes.add("High transaction volume with minimal balance - possible mixer/tumbler");
        }

        if (sentTx > 0 && receivedTx > 0) {
            double ratio = sentTx / receivedTx;
            if (ratio > e.getImbalanceHighRatio() || ratio < e.getImbalanceLowRatio()) {
                notes.add(String.format("Highly imbalanced transaction ratio (%.2f)", ratio));
            }
        }

        if (feature(features, "total Ether sent") > e.getHighValueThreshold()
                || feature(features, "total ether received") > e.getHighValueThreshold()) {
            notes.add("Large value movements detected - high-value account");
        }

        double spanMinutes = feature(features, "Time Diff between first and last (Mins)");
        if (spanMinutes < e.getBotMaxSpanMinutes() && sentTx + receivedTx > e.getBotMinTxns()) {
            notes.add("High activity in short time period - possible bot");
        }

        if (neighbors.getConfidence() < e.getLowNeighborConfidence()) {
            notes.add("Low neighbor confidence - unusual account pattern");
        }

        double tokenTx = feature(features, " Total ERC20 tnxs");
        double totalTx = feature(features, "total transactions (including tnx to create contract)");
        if (totalTx > 0 && tokenTx / totalTx > e.getTokenHeavyShare()) {
            notes.add("Heavy fungible token usage - DeFi power user");
        }

        for (PatternDimension dimension : PatternDimension.values()) {
            double risk = patterns.riskLevel(dimension);
            if (risk > e.getHighRiskDimension()) {
                notes.add(String.format("High-risk %s patterns detected (score: %.2f)",
                        dimension.getDisplayName(), risk));
            }
        }
        return notes;
    }

    private static double feature(Map<String, Double> features, String name) {
        Double value = features.get(name);
        return value == null ? 0.0 : Numbers.finiteOrZero(value);
    }
}
