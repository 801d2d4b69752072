package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Record of one alert suppressed by one rule.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuppressionInstance {

    private String id;

    private String ruleId;

    private String alertId;

    private String source;

    private Instant suppressedAt;

    /** Null for permanent suppressions */
    private Instant expiresAt;

    @Builder.Default
    private SuppressionStatus status = SuppressionStatus.ACTIVE;

    private String reason;
}
