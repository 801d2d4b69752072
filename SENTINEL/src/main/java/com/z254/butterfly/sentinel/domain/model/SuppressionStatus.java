package com.z254.butterfly.sentinel.domain.model;

public enum SuppressionStatus {
    ACTIVE,
    EXPIRED,
    CANCELLED
}
