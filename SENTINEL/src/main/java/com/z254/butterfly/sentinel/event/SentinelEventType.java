package com.z254.butterfly.sentinel.event;

/**
 * Notifications published to external subscribers such as dashboards and dispatchers.
 */
public enum SentinelEventType {
    // Deduplication
    NEW_GROUP,
    GROUP_UPDATED,
    ALERT_SUPPRESSED,
    GROUP_EXPIRED,

    // Scoring
    HIGH_IMPACT_ALERT,

    // Suppression rules
    RULE_SUPPRESSED,
    MAINTENANCE_STARTED,
    MAINTENANCE_ENDED,

    // Enrichment
    ALERT_ENRICHED,

    // Analytics
    PATTERN_DETECTED,
    INSIGHT_GENERATED,

    // Escalation
    ESCALATION_STARTED,
    ESCALATION_ADVANCED,
    ESCALATION_ACKNOWLEDGED,
    ESCALATION_RESOLVED,
    ESCALATION_EXHAUSTED,

    // Pipeline
    PERFORMANCE_BUDGET_EXCEEDED
}
