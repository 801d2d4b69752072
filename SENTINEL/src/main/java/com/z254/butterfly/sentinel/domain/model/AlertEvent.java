package com.z254.butterfly.sentinel.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Immutable record of one lifecycle transition for one alert.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AlertEvent {

    String id;

    String alertId;

    Instant timestamp;

    AlertEventType type;

    String source;

    Severity severity;

    Duration duration;

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    @Singular
    Set<String> tags;

    /** Business impact score, absent when the alert was never scored */
    Double businessImpactScore;

    public boolean hasScore() {
        return businessImpactScore != null;
    }

    public String firstTag() {
        return tags.isEmpty() ? null : tags.iterator().next();
    }
}
