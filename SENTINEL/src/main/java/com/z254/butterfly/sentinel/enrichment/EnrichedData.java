package com.z254.butterfly.sentinel.enrichment;

import com.z254.butterfly.sentinel.domain.model.EnrichmentType;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Context gathered for one alert by one enrichment rule.
 */
@Value
@Builder(toBuilder = true)
public class EnrichedData {

    String ruleId;

    String sourceId;

    EnrichmentType type;

    Instant timestamp;

    Object data;

    String query;

    int resultCount;

    Duration executionTime;

    boolean cached;

    String summary;
}
