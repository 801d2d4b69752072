package com.z254.butterfly.sentinel.analytics;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Operator-facing observation derived from the current metrics snapshot.
 */
@Value
@Builder
public class AlertInsight {

    String id;

    InsightLevel level;

    String title;

    String description;

    double confidence;

    List<String> recommendations;

    Instant generatedAt;
}
