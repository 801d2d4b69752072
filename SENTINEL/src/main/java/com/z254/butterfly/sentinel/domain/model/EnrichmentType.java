package com.z254.butterfly.sentinel.domain.model;

/**
 * Kind of context an enrichment rule gathers.
 */
public enum EnrichmentType {
    LOGS,
    METRICS,
    TRACES,
    CONTEXT,
    RELATED_ALERTS
}
