package com.dashboard.insights.service;

import com.dashboard.insights.model.InsightSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default sink: writes the summary to the application log.
 */
@Component
public class LoggingReportSink implements ReportSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingReportSink.class);

    @Override
    public void deliver(InsightSummary summary) {
        log.info("Insight summary '{}' for {}", summary.getSubject(), summary.getRecipients());
        log.debug("Insight summary body:\n{}", summary.getNarrative());
    }
}
