package com.dashboard.insights.contract;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract test that validates the OpenAPI document structure.
 * Ensures all endpoints and critical schemas are present,
 * protecting dashboard consumers from accidental schema drift.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    private DocumentContext apiDocs() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        return JsonPath.parse(response.getBody());
    }

    @Test
    void openApiDocs_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiDocs_containsAllEndpointPaths() {
        Map<String, Object> paths = apiDocs().read("$.paths");

        // Anomaly endpoints
        assertThat(paths).containsKey("/api/v1/anomalies/detect");

        // Trend endpoints
        assertThat(paths).containsKey("/api/v1/trends/analyze");
        assertThat(paths).containsKey("/api/v1/trends/forecast");
        assertThat(paths).containsKey("/api/v1/trends/capabilities");

        // Insight endpoints
        assertThat(paths).containsKey("/api/v1/insights/summary");
    }

    @Test
    void openApiDocs_containsCriticalSchemas() {
        Map<String, Object> schemas = apiDocs().read("$.components.schemas");

        assertThat(schemas).containsKey("Dataset");
        assertThat(schemas).containsKey("AnomalyDetectionResult");
        assertThat(schemas).containsKey("TrendReport");
        assertThat(schemas).containsKey("ForecastResponse");
        assertThat(schemas).containsKey("InsightRequest");
        assertThat(schemas).containsKey("InsightSummary");
    }

    @Test
    void openApiDocs_datasetAndSummarySchemas_haveRequiredFields() {
        DocumentContext json = apiDocs();

        Map<String, Object> datasetProps = json.read("$.components.schemas.Dataset.properties");
        assertThat(datasetProps).containsKey("dateColumn");
        assertThat(datasetProps).containsKey("numericColumns");
        assertThat(datasetProps).containsKey("rows");

        Map<String, Object> summaryProps = json.read("$.components.schemas.AnomalySummary.properties");
        assertThat(summaryProps).containsKey("totalRecords");
        assertThat(summaryProps).containsKey("consensusAnomalies");
        assertThat(summaryProps).containsKey("methodsRun");
        assertThat(summaryProps).containsKey("failedMethods");
    }
}
