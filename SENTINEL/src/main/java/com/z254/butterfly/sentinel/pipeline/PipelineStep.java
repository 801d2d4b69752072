package com.z254.butterfly.sentinel.pipeline;

public enum PipelineStep {
    VALIDATION,
    DEDUPLICATION,
    SCORING,
    SUPPRESSION,
    ENRICHMENT,
    ESCALATION,
    ANALYTICS
}
