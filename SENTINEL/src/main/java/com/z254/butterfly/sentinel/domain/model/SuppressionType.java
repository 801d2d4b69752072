package com.z254.butterfly.sentinel.domain.model;

public enum SuppressionType {
    /** Suppresses while the rule matches, no expiry */
    PERMANENT,
    /** Suppression instance expires after a duration or at a fixed end time */
    TEMPORARY
}
