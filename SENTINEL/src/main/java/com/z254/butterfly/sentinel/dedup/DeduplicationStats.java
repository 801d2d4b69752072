package com.z254.butterfly.sentinel.dedup;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DeduplicationStats {

    long totalAlerts;

    /** Alerts that started a new group */
    long uniqueAlerts;

    long suppressedAlerts;

    long expiredGroups;

    int activeGroups;

    double averageProcessingMillis;

    /** {@code (total - unique) / total}, 0 before any alert */
    double dedupRate;
}
