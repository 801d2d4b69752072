package com.z254.butterfly.sentinel.analytics;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class AnalyticsResult {

    AnalyticsQuery query;

    /** Sorted by count, descending */
    List<AnalyticsRow> rows;

    QueryAggregations aggregations;

    long totalEvents;

    Instant executedAt;

    /** True when served from the query cache; cached results may miss newer events */
    boolean cached;
}
