package com.z254.butterfly.sentinel.exception;

public class ScoringConfigurationException extends SentinelException {

    public ScoringConfigurationException(String message) {
        super(message);
    }
}
