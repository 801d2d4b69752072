package com.z254.butterfly.sentinel.exception;

/**
 * Base type for contract violations raised by the alert processing core.
 */
public class SentinelException extends RuntimeException {

    public SentinelException(String message) {
        super(message);
    }

    public SentinelException(String message, Throwable cause) {
        super(message, cause);
    }
}
