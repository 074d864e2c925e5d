package com.fincube.fraud.engine.reasoning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fincube.fraud.engine.Numbers;
import com.fincube.fraud.exception.OracleMalformedResponseException;
import com.fincube.fraud.model.FraudLabel;
import com.fincube.fraud.model.TentativeDecision;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts a tentative decision from untrusted oracle text.
 *
 * The JSON payload is taken from the first ```json fence, else the first bare
 * ``` fence, else the outermost {...} span. Accepted keys: final_decision or
 * decision, reasoning, confidence, edge_cases_detected or edge_cases, risk_factors.
 */
public final class ReasoningResponseParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String JSON_FENCE = "```json";
    private static final String FENCE = "```";

    private ReasoningResponseParser() {
    }

    public static TentativeDecision parse(String text) {
        if (text == null || text.isBlank()) {
            throw new OracleMalformedResponseException("Empty oracle response");
        }

        String payload = extractJson(text);
        JsonNode root;
        try {
            root = MAPPER.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new OracleMalformedResponseException("Oracle response is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new OracleMalformedResponseException("Oracle response is not a JSON object");
        }

        JsonNode decisionNode = root.hasNonNull("final_decision") ? root.get("final_decision") : root.get("decision");
        FraudLabel label = decisionNode == null ? null : parseLabel(decisionNode.asText());
        if (label == null) {
            throw new OracleMalformedResponseException("Unrecognised decision: "
                    + (decisionNode == null ? "<missing>" : decisionNode.asText()));
        }

        return TentativeDecision.builder()
                .label(label)
                .reasoning(root.path("reasoning").asText(""))
                .confidence(parseConfidence(root.get("confidence")))
                .edgeCases(strings(root.has("edge_cases_detected") ? root.get("edge_cases_detected") : root.get("edge_cases")))
                .riskFactors(strings(root.get("risk_factors")))
                .fallback(false)
                .build();
    }

    static String extractJson(String text) {
        int jsonFence = text.indexOf(JSON_FENCE);
        if (jsonFence >= 0) {
            return between(text, jsonFence + JSON_FENCE.length());
        }
        int fence = text.indexOf(FENCE);
        if (fence >= 0) {
            return between(text, fence + FENCE.length());
        }
        int open = text.indexOf('{');
        int close = text.lastIndexOf('}');
        if (open >= 0 && close > open) {
            return text.substring(open, close + 1);
        }
        throw new OracleMalformedResponseException("No JSON object found in oracle response");
    }

    private static String between(String text, int start) {
        int end = text.indexOf(FENCE, start);
        String inner = (end >= 0 ? text.substring(start, end) : text.substring(start)).trim();
        // Language tags other than json, e.g. ```JSON or ```javascript
        int open = inner.indexOf('{');
        int close = inner.lastIndexOf('}');
        return open >= 0 && close > open ? inner.substring(open, close + 1) : inner;
    }

    private static FraudLabel parseLabel(String text) {
        FraudLabel label = FraudLabel.fromText(text);
        if (label != null) return label;
        String key = text == null ? "" : text.trim().toLowerCase();
        if (key.equals("true")) return FraudLabel.FRAUD;
        if (key.equals("false")) return FraudLabel.NOT_FRAUD;
        return null;
    }

    private static double parseConfidence(JsonNode node) {
        if (node == null || node.isNull()) return 0.5;
        if (node.isNumber()) return Numbers.clamp01(node.asDouble());
        try {
            return Numbers.clamp01(Double.parseDouble(node.asText().trim()));
        } catch (NumberFormatException e) {
            throw new OracleMalformedResponseException("Non-numeric confidence: " + node.asText());
        }
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull()) return values;
        if (node.isArray()) {
            node.forEach(item -> {
                String value = item.isTextual() ? item.asText() : item.toString();
                if (!value.isBlank()) values.add(value);
            });
        } else if (node.isTextual() && !node.asText().isBlank()) {
            values.add(node.asText());
        }
        return values;
    }
}
