package com.fincube.fraud.engine;

import com.fincube.fraud.model.AccountActivity;
import com.fincube.fraud.model.FeatureVector;
import com.fincube.fraud.model.NeighborAnalysis;
import com.fincube.fraud.model.NeighborMatch;
import com.fincube.fraud.model.PatternReport;
import com.fincube.fraud.model.Scaler;
import com.fincube.fraud.model.ScoreDecision;
import com.fincube.fraud.model.TentativeDecision;
import com.fincube.fraud.model.ValidationReport;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Immutable state of one scoring request. Each pipeline stage returns a copy
 * extended with its own output and advanced to the next stage.
 */
@Value
@Builder(toBuilder = true)
public class ScoringContext {

    public enum Stage {
        FEATURE_BUILD,
        NEIGHBOR_EVIDENCE,
        PATTERN_DETECT,
        AGGREGATE,
        VALIDATE,
        REASON,
        FUSE,
        DONE
    }

    String referenceId;
    String address;
    AccountActivity activity;

    // Scaler snapshot captured when the request started
    Scaler scaler;

    Map<String, Double> features;
    FeatureVector rawVector;
    FeatureVector normalizedVector;
    List<NeighborMatch> neighbors;
    NeighborAnalysis neighborAnalysis;

    PatternReport patternReport;
    List<String> edgeCases;
    ValidationReport validation;
    TentativeDecision tentative;
    ScoreDecision decision;

    @Builder.Default
    Stage stage = Stage.FEATURE_BUILD;

    public ScoringContext advance(Stage next) {
        return toBuilder().stage(next).build();
    }

    public double getBehavioralRisk() {
        return patternReport == null ? 0.0 : patternReport.getBehavioralRisk();
    }
}
