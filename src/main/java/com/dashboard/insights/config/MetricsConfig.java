package com.dashboard.insights.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDetection(int rows, long consensusAnomalies) {
        Counter.builder("detection.run.count")
                .register(registry)
                .increment();

        DistributionSummary.builder("detection.rows")
                .register(registry)
                .record(rows);

        Counter.builder("detection.consensus.count")
                .register(registry)
                .increment(consensusAnomalies);
    }

    public void recordDetectorFlags(String detectorType, long flagged) {
        Counter.builder("detector.flagged.count")
                .tag("detector", detectorType)
                .register(registry)
                .increment(flagged);
    }

    public void recordDetectorFailure(String detectorType) {
        Counter.builder("detector.failure.count")
                .tag("detector", detectorType)
                .register(registry)
                .increment();
    }

    public void recordForecast(String model, String status) {
        Counter.builder("forecast.count")
                .tag("model", model)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordTrendComponentFailure(String component) {
        Counter.builder("trend.component.failure.count")
                .tag("component", component)
                .register(registry)
                .increment();
    }

    public void recordDelivery(String status) {
        Counter.builder("insight.delivery.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
