package com.dashboard.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Anomaly flag set for one dataset row")
public class RowAnomalies {

    @Schema(description = "Row position after sorting by the date column", example = "50")
    private int index;

    @Schema(description = "Row timestamp, absent when the dataset has no date column", example = "2024-02-20T00:00:00")
    private LocalDateTime timestamp;

    @Schema(description = "Per-detector flags keyed by detector label (TYPE or TYPE:column)")
    private Map<DetectorId, DetectorFlag> flags;

    @Schema(description = "Number of detectors that flagged this row", example = "3")
    private int voteCount;

    @Schema(description = "Number of detectors that could judge this row", example = "10")
    private int applicableCount;

    @Schema(description = "True when at least two detectors flagged this row", example = "true")
    private boolean consensus;
}
