package com.z254.butterfly.sentinel.pipeline;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PipelineHealth {

    Status status;

    double errorRate;

    double averageProcessingMillis;

    int activeGroups;

    int activeEscalations;

    int retainedEvents;

    long activePatterns;

    public enum Status {
        HEALTHY,
        DEGRADED,
        UNHEALTHY
    }
}
