package com.dashboard.insights.exception;

/**
 * Seasonal models need at least two full cycles of history.
 */
public class InsufficientHistoryException extends InsufficientDataException {

    public InsufficientHistoryException(int seasonalPeriod, int actual) {
        super(String.format("At least two full seasonal cycles (%d points) are required, got %d",
                2 * seasonalPeriod, actual), 2 * seasonalPeriod, actual);
    }
}
