package com.z254.butterfly.sentinel.analytics;

import com.z254.butterfly.sentinel.domain.model.Severity;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Whole-result aggregations over the filtered events.
 */
@Value
@Builder
public class QueryAggregations {

    long totalEvents;

    long uniqueSources;

    /** Created events per severity */
    Map<Severity, Long> severityDistribution;

    /** Created events per UTC hour of day ({@code 00}-{@code 23}) */
    Map<String, Long> hourlyDistribution;

    double averageBusinessImpact;

    /** Resolved per created, percent */
    double resolutionRate;

    double escalationRate;

    double suppressionRate;
}
