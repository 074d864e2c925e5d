package com.fincube.fraud.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "fraud")
public class FraudScoringConfig {

    // Number of nearest reference accounts requested from the similarity index.
    private int knnNeighbors = 10;

    // Probability threshold of the neighbor-only decision helper. The dead zone is [1 - t, t).
    private double decisionThreshold = 0.5;

    // Neighbor confidence below which the neighbor-only helper answers Undecided.
    private double confidenceFloor = 0.4;

    // Worker threads for the concurrent feature/pattern stages.
    private int scoringPoolSize = 8;

    private Patterns patterns = new Patterns();

    private Aggregation aggregation = new Aggregation();

    private Validation validation = new Validation();

    private Guardrails guardrails = new Guardrails();

    private Fallback fallback = new Fallback();

    private EdgeCases edgeCases = new EdgeCases();

    @Data
    public static class Patterns {
        // Temporal
        private double burstGapSeconds = 60.0;
        private int burstMinCount = 5;
        private double burstWeight = 0.3;
        private int regularMinGaps = 10;
        private double regularMaxCv = 0.1;
        private double regularMaxMeanSeconds = 3600.0;
        private double regularWeight = 0.2;
        private int nightStartHourUtc = 1;
        private int nightEndHourUtc = 5;
        private double nightMinShare = 0.7;
        private double nightWeight = 0.1;
        private double shortLifespanHours = 24.0;
        private int shortLifespanMinCount = 50;
        private double shortLifespanWeight = 0.4;

        // Value
        private List<Double> roundValues = List.of(0.1, 0.5, 1.0, 5.0, 10.0, 50.0, 100.0, 1000.0);
        private double roundTolerance = 0.001;
        private double roundMinShare = 0.5;
        private double roundWeight = 0.3;
        private int matchingWindow = 20;
        private double matchingTolerance = 0.01;
        private double matchingWeight = 0.4;
        private double mixerMinTotal = 10.0;
        private double mixerMinBalanceRatio = 0.9;
        private int mixerMinSentCount = 20;
        private double mixerWeight = 0.5;
        private int drainingMinSamples = 10;
        private double drainingMaxCv = 0.2;
        private double drainingWeight = 0.2;

        // Network
        private double diversityMinRatio = 0.8;
        private int diversityMinTxns = 50;
        private double diversityWeight = 0.4;
        private double oneTimeMinRatio = 0.7;
        private int oneTimeMinInteractions = 20;
        private double oneTimeWeight = 0.3;
        private int circularMinOverlap = 5;
        private int circularMinTxns = 10;
        private double circularMinRatio = 0.3;
        private double circularWeight = 0.5;
        private List<String> denylistPatterns = List.of("0x00000", "0x11111", "0xdead", "0xaaaa", "0xbbbb");
        private int denylistMinMatches = 5;
        private double denylistWeight = 0.2;

        // Token
        private int tokenDiversityMinContracts = 30;
        private double tokenDiversityWeight = 0.3;
        private int washMinFlowPerSide = 3;
        private int washMaxImbalance = 2;
        private int washMinContracts = 3;
        private double washWeight = 0.6;
        private int nftMinCount = 20;
        private double nftWeight = 0.1;

        // Behavioral
        private int dustMinTxns = 100;
        private double dustMaxBalance = 0.01;
        private double dustWeight = 0.5;
        private int forwardingMinPerSide = 10;
        private double forwardingWindowSeconds = 300.0;
        private int forwardingMinCount = 10;
        private double forwardingWeight = 0.6;
        private int asymmetryMinTxns = 20;
        private double asymmetryHighShare = 0.9;
        private double asymmetryLowShare = 0.1;
        private double asymmetryWeight = 0.2;
        private int zeroValueMinTxns = 50;
        private double zeroValueMinShare = 0.5;
        private double zeroValueWeight = 0.3;
    }

    @Data
    public static class Aggregation {
        private double temporalWeight = 0.15;
        private double valueWeight = 0.25;
        private double networkWeight = 0.25;
        private double tokenWeight = 0.15;
        private double behavioralWeight = 0.20;
    }

    @Data
    public static class Validation {
        private double alignmentHighProbability = 0.7;
        private double alignmentHighRisk = 0.6;
        private double alignmentLowProbability = 0.3;
        private double alignmentLowRisk = 0.4;
        private double confidenceFloor = 0.4;
        private double highRiskLevel = 0.5;
        private int minHighRiskDimensions = 2;
        private double alignmentWeight = 0.3;
        private double confidenceWeight = 0.2;
        private double multipleSignalWeight = 0.3;
        private double agreementWeight = 0.2;
    }

    @Data
    public static class Guardrails {
        // Rule 1: insufficient neighbor evidence forces Undecided.
        private double minNeighborConfidence = 0.25;
        private double insufficientEvidenceConfidenceCap = 0.4;

        // Rule 2: unsupported fraud call.
        private double fraudMaxProbability = 0.5;
        private double fraudMaxRisk = 0.4;
        private double fraudMinNeighborConfidence = 0.3;

        // Rule 3: legitimate call contradicted by strong fraud signals.
        private double notFraudMinProbability = 0.6;
        private double notFraudMinRisk = 0.6;

        private double downgradeConfidenceCap = 0.5;
    }

    @Data
    public static class Fallback {
        private double fraudProbabilityHigh = 0.6;
        private double fraudProbabilityLow = 0.4;
        private double behavioralRiskHigh = 0.6;
        private double behavioralRiskLow = 0.35;
        private int strongVotes = 2;
        private int archetypeVotes = 1;
        private int alignmentVotes = 1;
        private int decisiveVotes = 3;
        private double maxConfidence = 0.7;
        private double voteScale = 5.0;
        private double undecidedConfidence = 0.4;
    }

    @Data
    public static class EdgeCases {
        private int mixerMinTxns = 100;
        private double mixerMaxBalance = 0.1;
        private double imbalanceHighRatio = 10.0;
        private double imbalanceLowRatio = 0.1;
        private double highValueThreshold = 1000.0;
        private double botMaxSpanMinutes = 1440.0;
        private int botMinTxns = 50;
        private double lowNeighborConfidence = 0.5;
        private double tokenHeavyShare = 0.8;
        private double highRiskDimension = 0.5;
    }
}
