package com.dashboard.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Per-row anomaly flags plus summary for a dataset")
public class AnomalyDetectionResult {

    @Schema(description = "Flag sets in dataset order")
    private List<RowAnomalies> rows;

    @Schema(description = "Aggregate counts")
    private AnomalySummary summary;

    @Schema(description = "Analysis timestamp in epoch milliseconds", example = "1739886764000")
    private long analyzedAt;
}
