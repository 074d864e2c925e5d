package com.fincube.fraud.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fincube.fraud.config.ReasoningOracleConfig;
import com.fincube.fraud.engine.reasoning.ReasoningOracle;
import com.fincube.fraud.engine.reasoning.ReasoningPromptBuilder;
import com.fincube.fraud.exception.OracleTransportException;
import com.fincube.fraud.model.ReasoningRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;

/**
 * Reasoning oracle backed by the Gemini {@code generateContent} endpoint.
 * Returns the text of the first candidate unparsed.
 */
@Service
public class GeminiReasoningOracle implements ReasoningOracle {

    private static final Logger log = LoggerFactory.getLogger(GeminiReasoningOracle.class);

    private final RestClient restClient;
    private final ReasoningOracleConfig config;
    private final ReasoningPromptBuilder promptBuilder;

    public GeminiReasoningOracle(@Qualifier("oracleRestClient") RestClient restClient,
                                 ReasoningOracleConfig config,
                                 ReasoningPromptBuilder promptBuilder) {
        this.restClient = restClient;
        this.config = config;
        this.promptBuilder = promptBuilder;
    }

    @Override
    public String judge(ReasoningRequest request) {
        Map<String, Object> body = Map.of(
                "systemInstruction", Map.of("parts", List.of(Map.of("text", promptBuilder.systemInstruction()))),
                "contents", List.of(Map.of(
                        "role", "user",
                        "parts", List.of(Map.of("text", promptBuilder.userPrompt(request))))),
                "generationConfig", Map.of("temperature", config.getTemperature()));

        JsonNode response;
        try {
            response = restClient.post()
                    .uri(config.getBaseUrl() + "/models/{model}:generateContent?key={key}",
                            config.getModel(), config.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new OracleTransportException("Gemini request failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new OracleTransportException("Empty Gemini response");
        }

        JsonNode text = response.path("candidates").path(0).path("content").path("parts").path(0).path("text");
        if (text.isMissingNode() || text.isNull()) {
            log.warn("Gemini returned no candidate text for {}", request.getAddress());
            return "";
        }
        return text.asText();
    }
}
