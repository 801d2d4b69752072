package com.z254.butterfly.sentinel.analytics;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One aggregate row per group key.
 */
@Value
@Builder
public class AnalyticsRow {

    /** Per-dimension values joined with {@code |}, or {@code all} without grouping */
    String key;

    Map<GroupByDimension, String> dimensions;

    long count;

    Map<AnalyticsMetric, Double> values;
}
