package com.z254.butterfly.sentinel.domain.model;

/**
 * Lifecycle transitions recorded in the analytics event log.
 */
public enum AlertEventType {
    CREATED,
    ACKNOWLEDGED,
    ESCALATED,
    RESOLVED,
    SUPPRESSED,
    ENRICHED,
    SCORED,
    GROUPED
}
