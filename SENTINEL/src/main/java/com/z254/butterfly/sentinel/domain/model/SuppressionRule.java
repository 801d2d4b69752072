package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Condition/action pair evaluated by the suppression engine. Higher priority is evaluated first.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SuppressionRule {

    private String id;

    private String name;

    private String description;

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private int priority = 0;

    @Builder.Default
    private SuppressionConditions conditions = SuppressionConditions.builder().build();

    @Builder.Default
    private SuppressionAction action = SuppressionAction.permanent();

    /** Set for rules generated from a maintenance window */
    private String maintenanceWindowId;

    private Instant createdAt;
}
