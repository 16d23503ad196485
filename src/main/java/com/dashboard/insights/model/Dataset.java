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
@Schema(description = "Tabular dataset keyed by an optional date column with one or more numeric metric columns")
public class Dataset {

    @Schema(description = "Name of the date/timestamp column (ISO-8601 values). Rows are sorted by it when present.",
            example = "Date")
    private String dateColumn;

    @Schema(description = "Numeric metric columns to analyze", example = "[\"TotalSales\", \"OrderCount\"]")
    private List<String> numericColumns;

    @Schema(description = "Rows as column name -> value maps. Missing or null numeric values are treated as missing.")
    private List<Map<String, Object>> rows;
}
