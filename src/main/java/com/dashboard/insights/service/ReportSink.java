package com.dashboard.insights.service;

import com.dashboard.insights.model.InsightSummary;

/**
 * Destination for rendered insight summaries (mail relay, chat webhook, ...).
 */
public interface ReportSink {

    /**
     * Hand the summary to its recipients. Implementations may throw; the caller records the failure.
     */
    void deliver(InsightSummary summary);
}
