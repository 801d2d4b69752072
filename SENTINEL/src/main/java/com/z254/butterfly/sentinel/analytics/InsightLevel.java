package com.z254.butterfly.sentinel.analytics;

public enum InsightLevel {
    INFO,
    WARNING,
    CRITICAL
}
