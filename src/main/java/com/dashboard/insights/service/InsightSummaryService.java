package com.dashboard.insights.service;

import com.dashboard.insights.config.DistributionConfig;
import com.dashboard.insights.exception.AnalysisException;
import com.dashboard.insights.exception.AnalysisFailedException;
import com.dashboard.insights.model.AnomalyDetectionResult;
import com.dashboard.insights.model.ForecastPoint;
import com.dashboard.insights.model.ForecastResult;
import com.dashboard.insights.model.GrowthMetrics;
import com.dashboard.insights.model.InsightRequest;
import com.dashboard.insights.model.InsightSummary;
import com.dashboard.insights.model.MethodFailure;
import com.dashboard.insights.model.TrendAnalysisRequest;
import com.dashboard.insights.model.TrendReport;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Combines anomaly detection and trend analysis into a KPI-style summary and hands it to
 * the distribution service when there are recipients.
 *
 * Either analysis may fail on its own; the summary then says so. Only when both fail is
 * the request rejected.
 */
@Service
public class InsightSummaryService {

    private static final Logger log = LoggerFactory.getLogger(InsightSummaryService.class);

    private static final DateTimeFormatter GENERATED_FORMAT = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.US);

    private final AnomalyDetectionService anomalyDetectionService;
    private final TrendAnalysisService trendAnalysisService;
    private final ReportDistributionService distributionService;
    private final DistributionConfig distributionConfig;

    public InsightSummaryService(AnomalyDetectionService anomalyDetectionService,
                                 TrendAnalysisService trendAnalysisService,
                                 ReportDistributionService distributionService,
                                 DistributionConfig distributionConfig) {
        this.anomalyDetectionService = anomalyDetectionService;
        this.trendAnalysisService = trendAnalysisService;
        this.distributionService = distributionService;
        this.distributionConfig = distributionConfig;
    }

    @Observed(name = "insight.summarize", contextualName = "summarize-insights")
    public InsightSummary summarize(InsightRequest request) {
        List<MethodFailure> failures = new ArrayList<>();

        AnomalyDetectionResult anomalies = null;
        try {
            anomalies = anomalyDetectionService.detect(request.getDataset());
            failures.addAll(anomalies.getSummary().getFailedMethods());
        } catch (AnalysisException e) {
            log.warn("Anomaly detection skipped for report '{}': {}", request.getReportName(), e.getMessage());
            failures.add(new MethodFailure("ANOMALY_DETECTION", e.getMessage()));
        }

        TrendReport trend = null;
        try {
            trend = trendAnalysisService.analyze(TrendAnalysisRequest.builder()
                    .dataset(request.getDataset())
                    .valueColumn(request.getTrendColumn())
                    .horizon(request.getHorizon())
                    .build());
            failures.addAll(trend.getFailures());
        } catch (AnalysisException e) {
            log.warn("Trend analysis skipped for report '{}': {}", request.getReportName(), e.getMessage());
            failures.add(new MethodFailure("TREND_ANALYSIS", e.getMessage()));
        }

        if (anomalies == null && trend == null) {
            throw new AnalysisFailedException("Neither anomaly detection nor trend analysis produced a result", failures);
        }

        Map<String, Object> metrics = metrics(anomalies, trend);
        List<String> recipients = request.getRecipients() != null && !request.getRecipients().isEmpty()
                ? List.copyOf(request.getRecipients())
                : List.copyOf(distributionConfig.getDefaultRecipients());

        InsightSummary summary = InsightSummary.builder()
                .reportName(request.getReportName())
                .subject(subject(request.getReportName(), anomalies, trend))
                .narrative(narrative(request.getReportName(), anomalies, trend, failures))
                .metrics(metrics)
                .failures(failures)
                .recipients(recipients)
                .generatedAt(System.currentTimeMillis())
                .build();

        if (!recipients.isEmpty()) {
            // async, does not delay the response
            distributionService.deliver(summary);
        }
        return summary;
    }

    private Map<String, Object> metrics(AnomalyDetectionResult anomalies, TrendReport trend) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        if (anomalies != null) {
            metrics.put("totalRecords", anomalies.getSummary().getTotalRecords());
            metrics.put("consensusAnomalies", anomalies.getSummary().getConsensusAnomalies());
            metrics.put("methodCounts", anomalies.getSummary().getMethodCounts());
        }
        if (trend != null) {
            metrics.put("metric", trend.getMetric());
            metrics.put("trendDirection", trend.getDirection().getLabel());
            metrics.put("trendStrength", trend.getStrength());
            metrics.put("movingAverage", trend.getMovingAverage());
            GrowthMetrics growth = trend.getGrowth();
            if (growth != null) {
                metrics.put("currentValue", growth.getCurrentValue());
                metrics.put("momGrowth", growth.getMomGrowth());
                metrics.put("yoyGrowth", growth.getYoyGrowth());
                metrics.put("cagr", growth.getCagr());
            }
            if (trend.getSeasonality() != null) {
                metrics.put("seasonalPeriod", trend.getSeasonality().getPrimaryPeriod());
            }
            if (trend.getStationarity() != null) {
                metrics.put("stationary", trend.getStationarity().getStationary());
            }
            Map<String, Double> nextValues = new LinkedHashMap<>();
            for (ForecastResult forecast : trend.getForecasts()) {
                if (!forecast.getPoints().isEmpty()) {
                    nextValues.put(forecast.getModel().name(), forecast.getPoints().get(0).value());
                }
            }
            metrics.put("nextForecast", nextValues);
        }
        return metrics;
    }

    private String subject(String reportName, AnomalyDetectionResult anomalies, TrendReport trend) {
        StringBuilder subject = new StringBuilder(distributionConfig.getSubjectPrefix())
                .append(' ').append(reportName);
        List<String> highlights = new ArrayList<>();
        if (anomalies != null) {
            highlights.add(anomalies.getSummary().getConsensusAnomalies() + " anomalies");
        }
        if (trend != null) {
            highlights.add("trend " + trend.getDirection().getLabel());
        }
        return subject.append(": ").append(String.join(", ", highlights)).toString();
    }

    private String narrative(String reportName, AnomalyDetectionResult anomalies, TrendReport trend,
                             List<MethodFailure> failures) {
        Map<String, String> kpis = new LinkedHashMap<>();
        if (anomalies != null) {
            kpis.put("Records Analyzed", String.valueOf(anomalies.getSummary().getTotalRecords()));
            kpis.put("Consensus Anomalies", String.valueOf(anomalies.getSummary().getConsensusAnomalies()));
        }
        if (trend != null) {
            kpis.put("Trend (" + trend.getMetric() + ")", String.format(Locale.US, "%s (R² %.2f)",
                    trend.getDirection().getLabel(), trend.getStrength()));
            GrowthMetrics growth = trend.getGrowth();
            if (growth != null) {
                kpis.put("Current Value", String.format(Locale.US, "%,.2f", growth.getCurrentValue()));
                kpis.put("Growth (Last Period)", percent(growth.getMomGrowth()));
                kpis.put("Growth (YoY)", percent(growth.getYoyGrowth()));
                kpis.put("CAGR", percent(growth.getCagr()));
            }
            if (trend.getSeasonality() != null && trend.getSeasonality().isHasSeasonality()) {
                kpis.put("Seasonal Period", trend.getSeasonality().getPrimaryPeriod() + " periods");
            }
            for (ForecastResult forecast : trend.getForecasts()) {
                List<ForecastPoint> points = forecast.getPoints();
                if (!points.isEmpty()) {
                    kpis.put("Forecast +" + points.size() + " (" + forecast.getModel().getDisplayName() + ")",
                            String.format(Locale.US, "%,.2f", points.get(points.size() - 1).value()));
                }
            }
        }

        StringBuilder text = new StringBuilder()
                .append(reportName).append(" - KPI Summary\n")
                .append("Generated: ").append(LocalDate.now().format(GENERATED_FORMAT)).append("\n\n")
                .append("Key Performance Indicators:\n");
        kpis.forEach((key, value) -> text.append(key).append(": ").append(value).append('\n'));
        if (!failures.isEmpty()) {
            text.append("\nNot available:\n");
            failures.forEach(f -> text.append(f.method()).append(": ").append(f.reason()).append('\n'));
        }
        return text.toString();
    }

    private static String percent(Double value) {
        return value == null ? "n/a" : String.format(Locale.US, "%+.1f%%", value);
    }
}
