package com.dashboard.insights.controller;

import com.dashboard.insights.model.InsightRequest;
import com.dashboard.insights.model.InsightSummary;
import com.dashboard.insights.service.InsightSummaryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/insights")
@Tag(name = "Insights", description = "KPI summaries combining anomalies and trends, with optional distribution")
public class InsightController {

    private final InsightSummaryService insightSummaryService;

    public InsightController(InsightSummaryService insightSummaryService) {
        this.insightSummaryService = insightSummaryService;
    }

    @Operation(summary = "Build an insight summary",
            description = "Runs anomaly detection and trend analysis on the dataset and renders a KPI summary. " +
                    "The summary is delivered asynchronously to the report sink when recipients are given " +
                    "or configured.")
    @PostMapping("/summary")
    public ResponseEntity<InsightSummary> summary(@Valid @RequestBody InsightRequest request) {
        return ResponseEntity.ok(insightSummaryService.summarize(request));
    }
}
