package com.z254.butterfly.sentinel.analytics;

public enum GroupByDimension {
    SOURCE,
    SEVERITY,
    /** First tag of the event, or {@code no-tag} */
    TAG,
    /** {@code yyyy-MM-dd-HH}, UTC */
    HOUR,
    /** {@code yyyy-MM-dd}, UTC */
    DAY
}
