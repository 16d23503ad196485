package com.dashboard.insights.exception;

import com.dashboard.insights.model.MethodFailure;

import java.util.List;

/**
 * No detector produced a result for the dataset. Carries the individual failures.
 */
public class AnalysisFailedException extends AnalysisException {

    private final List<MethodFailure> failures;

    public AnalysisFailedException(String message, List<MethodFailure> failures) {
        super(message);
        this.failures = List.copyOf(failures);
    }

    public List<MethodFailure> getFailures() { return failures; }
}
