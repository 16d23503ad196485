package com.dashboard.insights.controller;

import com.dashboard.insights.model.AnomalyDetectionResult;
import com.dashboard.insights.model.Dataset;
import com.dashboard.insights.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Consensus anomaly detection over dashboard metric tables")
public class AnomalyController {

    private final AnomalyDetectionService anomalyDetectionService;

    public AnomalyController(AnomalyDetectionService anomalyDetectionService) {
        this.anomalyDetectionService = anomalyDetectionService;
    }

    @Operation(summary = "Detect anomalies in a dataset",
            description = "Runs z-score, IQR and moving-average detectors on every numeric column plus an " +
                    "isolation forest across all columns. A row is a consensus anomaly when at least two " +
                    "detectors flag it. Detectors that cannot run are listed in the summary.")
    @PostMapping("/detect")
    public ResponseEntity<AnomalyDetectionResult> detect(@RequestBody Dataset dataset) {
        return ResponseEntity.ok(anomalyDetectionService.detect(dataset));
    }
}
