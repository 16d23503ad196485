package com.dashboard.insights.service;

import com.dashboard.insights.config.DistributionConfig;
import com.dashboard.insights.config.MetricsConfig;
import com.dashboard.insights.model.InsightSummary;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Fire-and-forget delivery of insight summaries to the configured {@link ReportSink}.
 */
@Service
public class ReportDistributionService {

    private static final Logger log = LoggerFactory.getLogger(ReportDistributionService.class);

    private final ReportSink sink;
    private final DistributionConfig config;
    private final MetricsConfig metricsConfig;

    public ReportDistributionService(ReportSink sink, DistributionConfig config, MetricsConfig metricsConfig) {
        this.sink = sink;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            log.info("Report distribution enabled. Sink: {}", sink.getClass().getSimpleName());
        } else {
            log.info("Report distribution is DISABLED.");
        }
    }

    @Async
    @Observed(name = "insight.deliver", contextualName = "deliver-insight")
    public void deliver(InsightSummary summary) {
        if (!config.isEnabled() || summary.getRecipients() == null || summary.getRecipients().isEmpty()) {
            return;
        }

        try {
            sink.deliver(summary);
            metricsConfig.recordDelivery("success");
            log.info("Insight summary '{}' delivered to {} recipients",
                    summary.getReportName(), summary.getRecipients().size());
        } catch (Exception e) {
            metricsConfig.recordDelivery("error");
            log.error("Failed to deliver insight summary '{}': {}", summary.getReportName(), e.getMessage(), e);
        }
    }
}
