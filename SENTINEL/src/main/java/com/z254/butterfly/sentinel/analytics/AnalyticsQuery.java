package com.z254.butterfly.sentinel.analytics;

import com.z254.butterfly.sentinel.domain.model.AlertEventType;
import com.z254.butterfly.sentinel.domain.model.Severity;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Analytics query. Value equality covers every field, time range included, so a query is its
 * own cache key.
 */
@Value
@Builder(toBuilder = true)
public class AnalyticsQuery {

    /** Inclusive lower bound */
    Instant from;

    /** Inclusive upper bound */
    Instant to;

    @Singular
    Set<String> sources;

    @Singular
    Set<Severity> severities;

    @Singular
    Set<AlertEventType> eventTypes;

    /** Events must carry at least one of these tags */
    @Singular
    Set<String> tags;

    /** Score bounds do not exclude events that were never scored */
    Double minScore;

    Double maxScore;

    /** Composite group key, in this order */
    @Singular("groupBy")
    List<GroupByDimension> groupBy;

    /** Defaults to COUNT when empty */
    @Singular
    List<AnalyticsMetric> metrics;
}
