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

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Forecast one metric column with one or more models")
public class ForecastRequest {

    @NotNull
    @Valid
    private Dataset dataset;

    @NotBlank
    @Schema(description = "Metric column to forecast", example = "TotalSales")
    private String valueColumn;

    @Min(1)
    @Schema(description = "Steps to forecast", example = "30")
    private Integer horizon;

    @Min(2)
    @Schema(description = "Seasonal period for exponential smoothing", example = "7")
    private Integer seasonalPeriod;

    @Schema(description = "Models to run; all enabled models when empty")
    private List<ForecastModel> models;

    @Schema(description = "ARIMA order override")
    private ArimaOrder arimaOrder;
}
