package com.z254.butterfly.sentinel.exception;

public class EscalationException extends SentinelException {

    public EscalationException(String message) {
        super(message);
    }
}
