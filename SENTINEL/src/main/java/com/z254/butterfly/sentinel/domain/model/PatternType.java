package com.z254.butterfly.sentinel.domain.model;

/**
 * Kind of recurring condition a pattern describes.
 */
public enum PatternType {
    HIGH_FREQUENCY,
    CASCADING_FAILURE,
    TIME_OF_DAY,
    SEVERITY_ESCALATION
}
