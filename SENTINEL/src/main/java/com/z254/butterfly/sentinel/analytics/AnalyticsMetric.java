package com.z254.butterfly.sentinel.analytics;

public enum AnalyticsMetric {
    COUNT,
    /** Mean time to resolution, milliseconds */
    MTTR,
    /** Mean time to acknowledgment, milliseconds */
    MTTA,
    SCORE_AVG,
    /** Nearest-rank 95th percentile of business impact scores */
    SCORE_P95,
    /** Events per hour of the query range */
    FREQUENCY,
    /** Escalated per created, percent */
    ESCALATION_RATE,
    /** Suppressed per created, percent */
    SUPPRESSION_RATE
}
