package com.z254.butterfly.sentinel.analytics;

public enum ExportFormat {
    JSON,
    CSV
}
