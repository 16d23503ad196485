package com.dashboard.insights.exception;

/**
 * Raised when a method is asked to run on fewer rows or points than it needs.
 */
public class InsufficientDataException extends AnalysisException {

    private final int required;
    private final int actual;

    public InsufficientDataException(String message, int required, int actual) {
        super(message);
        this.required = required;
        this.actual = actual;
    }

    public int getRequired() { return required; }
    public int getActual() { return actual; }
}
