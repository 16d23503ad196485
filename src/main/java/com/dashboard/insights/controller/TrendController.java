package com.dashboard.insights.controller;

import com.dashboard.insights.model.AnalysisCapabilities;
import com.dashboard.insights.model.ForecastRequest;
import com.dashboard.insights.model.ForecastResponse;
import com.dashboard.insights.model.TrendAnalysisRequest;
import com.dashboard.insights.model.TrendReport;
import com.dashboard.insights.service.TrendAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/trends")
@Tag(name = "Trends", description = "Trend characterization, seasonal decomposition and forecasting")
public class TrendController {

    private final TrendAnalysisService trendAnalysisService;

    public TrendController(TrendAnalysisService trendAnalysisService) {
        this.trendAnalysisService = trendAnalysisService;
    }

    @Operation(summary = "Analyze the trend of a metric",
            description = "Returns direction and strength, seasonality, growth rates, stationarity, peaks and " +
                    "troughs, a seasonal decomposition and forecasts from every enabled model. Components that " +
                    "cannot be computed are null and listed under failures.")
    @PostMapping("/analyze")
    public ResponseEntity<TrendReport> analyze(@Valid @RequestBody TrendAnalysisRequest request) {
        return ResponseEntity.ok(trendAnalysisService.analyze(request));
    }

    @Operation(summary = "Forecast a metric",
            description = "Runs the requested forecasting models (all enabled models when none are named). " +
                    "ARIMA results carry 95% prediction intervals.")
    @PostMapping("/forecast")
    public ResponseEntity<ForecastResponse> forecast(@Valid @RequestBody ForecastRequest request) {
        return ResponseEntity.ok(trendAnalysisService.forecast(request));
    }

    @Operation(summary = "List analysis capabilities",
            description = "Forecast models enabled on this instance and the supported decomposition models.")
    @GetMapping("/capabilities")
    public ResponseEntity<AnalysisCapabilities> capabilities() {
        return ResponseEntity.ok(trendAnalysisService.capabilities());
    }
}
