package com.z254.butterfly.sentinel.domain.model;

public enum PatternStatus {
    ACTIVE,
    INVESTIGATING,
    RESOLVED,
    IGNORED
}
