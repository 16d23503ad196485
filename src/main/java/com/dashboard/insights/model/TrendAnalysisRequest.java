package com.dashboard.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Trend analysis of one metric column of a dataset")
public class TrendAnalysisRequest {

    @NotNull
    @Valid
    private Dataset dataset;

    @NotBlank
    @Schema(description = "Metric column to analyze", example = "TotalSales")
    private String valueColumn;

    @Min(1)
    @Schema(description = "Forecast horizon; defaults to insights.trend.forecast.horizon", example = "30")
    private Integer horizon;

    @Min(2)
    @Schema(description = "Seasonal period for decomposition and exponential smoothing", example = "7")
    private Integer seasonalPeriod;

    @Schema(description = "Decomposition model", example = "ADDITIVE")
    private DecompositionModel decompositionModel;

    @Schema(description = "Minimum prominence for peaks and troughs; defaults to a fraction of the value range")
    private Double minProminence;

    @Schema(description = "ARIMA order override")
    private ArimaOrder arimaOrder;
}
