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
@Schema(description = "Plain-language and structured summary handed to the distribution sink")
public class InsightSummary {

    @Schema(description = "Report name", example = "Executive Dashboard")
    private String reportName;

    @Schema(description = "Rendered subject line", example = "[Insights] Executive Dashboard: 4 anomalies, trend Upward")
    private String subject;

    @Schema(description = "Plain-language summary")
    private String narrative;

    @Schema(description = "Key metrics (consensus count, growth, trend direction, ...)")
    private Map<String, Object> metrics;

    @Schema(description = "Methods that did not run")
    private List<MethodFailure> failures;

    @Schema(description = "Addresses the summary was handed to")
    private List<String> recipients;

    @Schema(description = "Generation timestamp in epoch milliseconds", example = "1739886764000")
    private long generatedAt;
}
