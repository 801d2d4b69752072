package com.z254.butterfly.sentinel.domain.model;

public enum MaintenanceWindowStatus {
    SCHEDULED,
    ACTIVE,
    COMPLETED,
    CANCELLED
}
