package com.fincube.fraud.contract;

import com.fincube.fraud.config.TestAerospikeConfig;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Guards the published API surface: every endpoint and the schemas clients
 * bind to must stay in the generated document.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestAerospikeConfig.class)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    private DocumentContext apiDocs() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        return JsonPath.parse(response.getBody());
    }

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        Map<String, Object> paths = apiDocs().read("$.paths");

        // Scoring
        assertThat(paths).containsKey("/api/v1/fraud/score");
        assertThat(paths).containsKey("/api/v1/fraud/score/activity");
        assertThat(paths).containsKey("/api/v1/fraud/score/{referenceId}");

        // Reference data
        assertThat(paths).containsKey("/api/v1/reference/load");
        assertThat(paths).containsKey("/api/v1/reference/load/csv");
        assertThat(paths).containsKey("/api/v1/reference/import");
        assertThat(paths).containsKey("/api/v1/reference/stats");
        assertThat(paths).containsKey("/api/v1/reference/scaler");
        assertThat(paths).containsKey("/api/v1/reference");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        Map<String, Object> schemas = apiDocs().read("$.components.schemas");

        assertThat(schemas).containsKey("ScoreRequest");
        assertThat(schemas).containsKey("ScoreResponse");
        assertThat(schemas).containsKey("ScoreDecision");
        assertThat(schemas).containsKey("NeighborAnalysis");
        assertThat(schemas).containsKey("ReferenceRecord");
        assertThat(schemas).containsKey("ReferenceImportRequest");
        assertThat(schemas).containsKey("TransferRecord");
    }

    @Test
    void openApiSpec_decisionSchema_hasRequiredFields() {
        DocumentContext json = apiDocs();

        Map<String, Object> decisionProps = json.read("$.components.schemas.ScoreDecision.properties");
        assertThat(decisionProps).containsKey("label");
        assertThat(decisionProps).containsKey("confidence");
        assertThat(decisionProps).containsKey("reasoning");
        assertThat(decisionProps).containsKey("riskFactors");
        assertThat(decisionProps).containsKey("edgeCases");

        Map<String, Object> responseProps = json.read("$.components.schemas.ScoreResponse.properties");
        assertThat(responseProps).containsKey("decision");
        assertThat(responseProps).containsKey("neighborAnalysis");
        assertThat(responseProps).containsKey("nearestNeighbors");
        assertThat(responseProps).containsKey("scalerVersion");
    }

    @Test
    void scoring_beforeReferenceLoad_returns503() {
        ResponseEntity<String> response = restTemplate.postForEntity("/api/v1/fraud/score/activity",
                Map.of("address", "0x7000000000000000000000000000000000001001"), String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }
}
