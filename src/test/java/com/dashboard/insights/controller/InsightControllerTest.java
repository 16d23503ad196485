package com.dashboard.insights.controller;

import com.dashboard.insights.model.InsightRequest;
import com.dashboard.insights.model.InsightSummary;
import com.dashboard.insights.service.InsightSummaryService;
import com.dashboard.insights.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(InsightController.class)
class InsightControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private InsightSummaryService insightSummaryService;

    @Test
    void summary_success() throws Exception {
        when(insightSummaryService.summarize(any())).thenReturn(InsightSummary.builder()
                .reportName("Executive Dashboard")
                .subject("[Insights] Executive Dashboard: 3 anomalies, trend Upward")
                .narrative("Executive Dashboard - KPI Summary")
                .metrics(Map.of("consensusAnomalies", 3))
                .failures(List.of())
                .recipients(List.of("cfo@example.com"))
                .generatedAt(1L)
                .build());
        InsightRequest request = InsightRequest.builder()
                .reportName("Executive Dashboard")
                .dataset(TestDataFactory.salesDataset(1, 2, 3))
                .trendColumn("TotalSales")
                .recipients(List.of("cfo@example.com"))
                .build();

        mockMvc.perform(post("/api/v1/insights/summary")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.subject").value("[Insights] Executive Dashboard: 3 anomalies, trend Upward"))
                .andExpect(jsonPath("$.metrics.consensusAnomalies").value(3))
                .andExpect(jsonPath("$.recipients[0]").value("cfo@example.com"));
    }

    @Test
    void summary_missingReportName_validationError() throws Exception {
        InsightRequest request = InsightRequest.builder()
                .dataset(TestDataFactory.salesDataset(1, 2, 3))
                .trendColumn("TotalSales")
                .build();

        mockMvc.perform(post("/api/v1/insights/summary")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("reportName must not be blank"));

        verify(insightSummaryService, never()).summarize(any());
    }
}
