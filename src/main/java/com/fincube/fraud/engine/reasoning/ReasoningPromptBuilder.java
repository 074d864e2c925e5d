package com.fincube.fraud.engine.reasoning;

import com.fincube.fraud.model.NeighborAnalysis;
import com.fincube.fraud.model.PatternDimension;
import com.fincube.fraud.model.PatternFinding;
import com.fincube.fraud.model.PatternReport;
import com.fincube.fraud.model.PatternTag;
import com.fincube.fraud.model.ReasoningRequest;
import com.fincube.fraud.model.ValidationReport;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a {@link ReasoningRequest} as the system instruction and user prompt
 * sent to a language-model oracle.
 */
@Component
public class ReasoningPromptBuilder {

    static final String SYSTEM_INSTRUCTION = String.join("\n",
            "You are an expert fraud detection system for Ethereum accounts, optimized for balanced accuracy.",
            "",
            "Mark as \"Fraud\" if any of these hold:",
            "1. Neighbor fraud probability > 0.65 and behavioral risk > 0.5",
            "2. Neighbor fraud probability > 0.6 and at least 2 strong fraud patterns",
            "3. Neighbor fraud probability > 0.5, behavioral risk > 0.6 and validation quality HIGH",
            "4. Behavioral risk > 0.7 and at least 3 strong fraud indicators (mixer, wash trading, ...)",
            "",
            "Mark as \"Not_Fraud\" if any of these hold:",
            "1. Neighbor fraud probability < 0.35 and behavioral risk < 0.35",
            "2. Neighbor fraud probability < 0.4 and no significant fraud patterns",
            "3. Neighbor fraud probability < 0.3 and behavioral risk < 0.5",
            "4. Clear legitimate DeFi or trading patterns with neighbor fraud probability < 0.5",
            "",
            "Mark as \"Undecided\" only when signals conflict around 0.4-0.6, neighbor confidence is",
            "below 0.3, or validation quality is LOW with no clear patterns.",
            "",
            "Respond ONLY with a JSON object of this shape:",
            "{",
            "  \"final_decision\": \"Fraud|Not_Fraud|Undecided\",",
            "  \"reasoning\": \"explanation citing specific evidence\",",
            "  \"confidence\": 0.0-1.0,",
            "  \"edge_cases_detected\": [\"...\"],",
            "  \"risk_factors\": [\"...\"]",
            "}");

    public String systemInstruction() {
        return SYSTEM_INSTRUCTION;
    }

    public String userPrompt(ReasoningRequest request) {
        NeighborAnalysis neighbors = request.getNeighborAnalysis();
        PatternReport patterns = request.getPatternReport();
        ValidationReport validation = request.getValidation();
        Map<String, Double> f = request.getFeatures() == null ? Map.of() : request.getFeatures();

        StringBuilder sb = new StringBuilder();
        sb.append("Make a final fraud determination for address ").append(request.getAddress()).append("\n\n");

        sb.append("Neighbor analysis:\n");
        sb.append(String.format("- Fraud probability: %.2f%n", neighbors.getFraudProbability()));
        sb.append(String.format("- Confidence: %.2f%n", neighbors.getConfidence()));
        sb.append(String.format("- Fraudulent neighbors: %d/%d%n", neighbors.getFraudCount(), neighbors.getTotalCount()));
        sb.append(String.format("- Average distance: %.4f%n%n", neighbors.getAvgDistance()));

        sb.append("Account statistics:\n");
        sb.append(String.format("- Total transactions: %.0f%n", value(f, "total transactions (including tnx to create contract)")));
        sb.append(String.format("- Sent: %.0f, Received: %.0f%n", value(f, "Sent tnx"), value(f, "Received Tnx")));
        sb.append(String.format("- Total ether sent: %.4f, received: %.4f%n",
                value(f, "total Ether sent"), value(f, "total ether received")));
        sb.append(String.format("- Balance: %.4f%n", value(f, "total ether balance")));
        sb.append(String.format("- Unique sent-to: %.0f, unique received-from: %.0f%n",
                value(f, "Unique Sent To Addresses"), value(f, "Unique Received From Addresses")));
        sb.append(String.format("- Fungible token transfers: %.0f%n%n", value(f, " Total ERC20 tnxs")));

        double risk = patterns.getBehavioralRisk();
        sb.append(String.format("Behavioral risk: %.2f (%s)%n", risk, riskAssessment(risk)));
        for (PatternDimension dimension : PatternDimension.values()) {
            PatternFinding finding = patterns.finding(dimension);
            String tags = finding.getTags().isEmpty()
                    ? "none"
                    : finding.getTags().stream().map(PatternTag::getDescription).collect(Collectors.joining("; "));
            sb.append(String.format("- %s (risk %.2f): %s%n", dimension.getDisplayName(), finding.getRiskLevel(), tags));
        }
        sb.append("\n");

        sb.append("Validation checks:\n");
        sb.append("- Neighbor/pattern alignment: ").append(validation.isNeighborPatternAlignment()).append("\n");
        sb.append("- Confidence threshold met: ").append(validation.isConfidenceThresholdMet()).append("\n");
        sb.append("- Multiple risk signals: ").append(validation.isMultipleRiskSignals()).append("\n");
        sb.append("- Archetypes: ").append(validation.getArchetypes().isEmpty() ? "none" : validation.getArchetypes()).append("\n");
        sb.append(String.format("- Validation score: %.2f, quality: %s%n%n",
                validation.getOverallValidationScore(), validation.getQualityTier()));

        List<String> edgeCases = request.getEdgeCases();
        sb.append("Edge cases:\n");
        if (edgeCases == null || edgeCases.isEmpty()) {
            sb.append("None\n");
        } else {
            edgeCases.forEach(ec -> sb.append("- ").append(ec).append("\n"));
        }

        sb.append("\nProvide your final decision in JSON format only.");
        return sb.toString();
    }

    static String riskAssessment(double risk) {
        if (risk > 0.6) return "HIGH RISK";
        if (risk > 0.35) return "MEDIUM RISK";
        return "LOW RISK";
    }

    private static double value(Map<String, Double> features, String name) {
        Double v = features.get(name);
        return v == null ? 0.0 : v;
    }
}
