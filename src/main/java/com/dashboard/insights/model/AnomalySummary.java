package com.dashboard.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Summary statistics of a consensus anomaly detection run")
public class AnomalySummary {

    @Schema(description = "Number of rows analyzed", example = "365")
    private int totalRecords;

    @Schema(description = "Flagged row count per detector label", example = "{\"ZSCORE:TotalSales\": 3, \"ISOLATION_FOREST\": 19}")
    private Map<String, Long> methodCounts;

    @Schema(description = "Rows flagged by at least two detectors", example = "4")
    private long consensusAnomalies;

    @Schema(description = "IQR bounds per metric column")
    private Map<String, IqrBounds> iqrBounds;

    @Schema(description = "Detector labels that produced results")
    private List<String> methodsRun;

    @Schema(description = "Detectors that failed; their flags are absent from every row")
    private List<MethodFailure> failedMethods;
}
