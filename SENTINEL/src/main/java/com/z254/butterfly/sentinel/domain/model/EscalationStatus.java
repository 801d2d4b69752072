package com.z254.butterfly.sentinel.domain.model;

public enum EscalationStatus {
    ACTIVE,
    ACKNOWLEDGED,
    RESOLVED,
    CANCELLED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
