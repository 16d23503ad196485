package com.dashboard.insights.controller;

import com.dashboard.insights.exception.ModelConvergenceException;
import com.dashboard.insights.model.AnalysisCapabilities;
import com.dashboard.insights.model.DecompositionModel;
import com.dashboard.insights.model.ForecastModel;
import com.dashboard.insights.model.ForecastPoint;
import com.dashboard.insights.model.ForecastRequest;
import com.dashboard.insights.model.ForecastResponse;
import com.dashboard.insights.model.ForecastResult;
import com.dashboard.insights.model.MethodFailure;
import com.dashboard.insights.model.TrendAnalysisRequest;
import com.dashboard.insights.model.TrendDirection;
import com.dashboard.insights.model.TrendReport;
import com.dashboard.insights.service.TrendAnalysisService;
import com.dashboard.insights.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.EnumSet;
import java.util.List;

import static org.hamcrest.Matchers.endsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TrendController.class)
class TrendControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private TrendAnalysisService trendAnalysisService;

    @Test
    void analyze_success() throws Exception {
        when(trendAnalysisService.analyze(any())).thenReturn(TrendReport.builder()
                .metric("TotalSales")
                .observations(30)
                .direction(TrendDirection.UPWARD)
                .slope(10.0)
                .strength(1.0)
                .forecasts(List.of())
                .failures(List.of(new MethodFailure("DECOMPOSITION", "too short")))
                .build());
        TrendAnalysisRequest request = TrendAnalysisRequest.builder()
                .dataset(TestDataFactory.salesDataset(TestDataFactory.linear(30, 100, 10)))
                .valueColumn("TotalSales")
                .build();

        mockMvc.perform(post("/api/v1/trends/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metric").value("TotalSales"))
                .andExpect(jsonPath("$.direction").value("UPWARD"))
                .andExpect(jsonPath("$.failures[0].method").value("DECOMPOSITION"));
    }

    @Test
    void analyze_missingValueColumn_validationError() throws Exception {
        TrendAnalysisRequest request = TrendAnalysisRequest.builder()
                .dataset(TestDataFactory.salesDataset(1, 2, 3))
                .build();

        mockMvc.perform(post("/api/v1/trends/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value(endsWith("/invalid-request")));

        verify(trendAnalysisService, never()).analyze(any());
    }

    @Test
    void analyze_unexpectedError_internalServerError() throws Exception {
        when(trendAnalysisService.analyze(any())).thenThrow(new IllegalStateException("bug"));
        TrendAnalysisRequest request = TrendAnalysisRequest.builder()
                .dataset(TestDataFactory.salesDataset(1, 2, 3))
                .valueColumn("TotalSales")
                .build();

        mockMvc.perform(post("/api/v1/trends/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.type").value(endsWith("/internal-error")));
    }

    @Test
    void forecast_success() throws Exception {
        when(trendAnalysisService.forecast(any())).thenReturn(ForecastResponse.builder()
                .metric("TotalSales")
                .forecasts(List.of(ForecastResult.builder()
                        .model(ForecastModel.ARIMA)
                        .points(List.of(new ForecastPoint(1, 30, 400.0, 390.0, 410.0)))
                        .parameter("sigma2", 25.0)
                        .build()))
                .failures(List.of())
                .build());
        ForecastRequest request = ForecastRequest.builder()
                .dataset(TestDataFactory.salesDataset(TestDataFactory.linear(30, 100, 10)))
                .valueColumn("TotalSales")
                .horizon(1)
                .models(List.of(ForecastModel.ARIMA))
                .build();

        mockMvc.perform(post("/api/v1/trends/forecast")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.forecasts[0].model").value("ARIMA"))
                .andExpect(jsonPath("$.forecasts[0].points[0].lower").value(390.0))
                .andExpect(jsonPath("$.forecasts[0].parameters.sigma2").value(25.0));
    }

    @Test
    void forecast_modelConvergence_unprocessable() throws Exception {
        when(trendAnalysisService.forecast(any()))
                .thenThrow(new ModelConvergenceException("ARIMA(1,1,1) has a degenerate innovation variance: 0.0"));
        ForecastRequest request = ForecastRequest.builder()
                .dataset(TestDataFactory.salesDataset(TestDataFactory.constant(30, 5.0)))
                .valueColumn("TotalSales")
                .build();

        mockMvc.perform(post("/api/v1/trends/forecast")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.type").value(endsWith("/model-convergence")));
    }

    @Test
    void forecast_horizonBelowOne_validationError() throws Exception {
        ForecastRequest request = ForecastRequest.builder()
                .dataset(TestDataFactory.salesDataset(1, 2, 3))
                .valueColumn("TotalSales")
                .horizon(0)
                .build();

        mockMvc.perform(post("/api/v1/trends/forecast")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest());
    }

    @Test
    void capabilities_success() throws Exception {
        when(trendAnalysisService.capabilities()).thenReturn(new AnalysisCapabilities(
                EnumSet.of(ForecastModel.LINEAR_TREND, ForecastModel.ARIMA),
                List.of(DecompositionModel.values())));

        mockMvc.perform(get("/api/v1/trends/capabilities"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.forecastModels[0]").value("LINEAR_TREND"))
                .andExpect(jsonPath("$.decompositionModels[1]").value("MULTIPLICATIVE"));
    }
}
