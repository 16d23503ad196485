package com.dashboard.insights.exception;

/**
 * Base type for all failures raised by the analytic core.
 */
public abstract class AnalysisException extends RuntimeException {

    protected AnalysisException(String message) {
        super(message);
    }

    protected AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
