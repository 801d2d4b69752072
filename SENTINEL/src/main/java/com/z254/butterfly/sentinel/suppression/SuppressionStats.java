package com.z254.butterfly.sentinel.suppression;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class SuppressionStats {

    int totalRules;

    int enabledRules;

    long alertsEvaluated;

    long alertsSuppressed;

    long activeSuppressions;

    long activeMaintenanceWindows;

    Map<String, Long> suppressionsByRule;
}
