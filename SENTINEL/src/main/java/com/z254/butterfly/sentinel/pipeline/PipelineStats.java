package com.z254.butterfly.sentinel.pipeline;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class PipelineStats {

    long totalAlerts;

    long rejectedAlerts;

    long suppressedAlerts;

    long escalatedAlerts;

    /** Alerts whose processing recorded at least one step error */
    long alertsWithErrors;

    long budgetViolations;

    double averageProcessingMillis;

    /** Percent of processed alerts with step errors */
    double errorRate;

    Map<PipelineStep, Double> averageStepMillis;
}
