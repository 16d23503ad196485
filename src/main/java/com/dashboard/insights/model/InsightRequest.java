package com.dashboard.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Run anomaly detection and trend analysis and render a summary for distribution")
public class InsightRequest {

    @NotBlank
    @Schema(description = "Report name used in the rendered subject", example = "Executive Dashboard")
    private String reportName;

    @NotNull
    @Valid
    private Dataset dataset;

    @NotBlank
    @Schema(description = "Metric column for trend analysis", example = "TotalSales")
    private String trendColumn;

    @Schema(description = "Forecast horizon", example = "30")
    private Integer horizon;

    @Schema(description = "Delivery addresses; the configured defaults are used when empty",
            example = "[\"cfo@example.com\"]")
    private List<String> recipients;
}
