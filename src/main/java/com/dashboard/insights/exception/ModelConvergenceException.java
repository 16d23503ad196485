package com.dashboard.insights.exception;

/**
 * A fitting procedure failed numerically or produced a degenerate model.
 */
public class ModelConvergenceException extends AnalysisException {

    public ModelConvergenceException(String message) {
        super(message);
    }

    public ModelConvergenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
