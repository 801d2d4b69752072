package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * One tier of an escalation policy.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationStep {

    private int order;

    @Builder.Default
    private List<String> roleIds = new ArrayList<>();

    /** Wait before auto-advancing when unacknowledged */
    @Builder.Default
    private Duration waitTime = Duration.ZERO;

    private StepConditions conditions;
}
