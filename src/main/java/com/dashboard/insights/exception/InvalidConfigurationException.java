package com.dashboard.insights.exception;

public class InvalidConfigurationException extends AnalysisException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
