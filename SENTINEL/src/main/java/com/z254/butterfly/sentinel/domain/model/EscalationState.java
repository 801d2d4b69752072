package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-alert escalation state machine instance.
 * <p>
 * {@code currentStep} is the index into the policy's ordered steps; {@code nextDeadline} is
 * the absolute instant at which the current step times out.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationState {

    private String id;

    private String alertId;

    private String policyId;

    private Severity severity;

    private String source;

    @Builder.Default
    private Set<String> tags = new HashSet<>();

    @Builder.Default
    private int currentStep = -1;

    private Instant stepEnteredAt;

    private Instant nextDeadline;

    @Builder.Default
    private EscalationStatus status = EscalationStatus.ACTIVE;

    private Instant createdAt;

    private String acknowledgedBy;

    private Integer acknowledgedStep;

    private Instant acknowledgedAt;

    private Instant resolvedAt;

    /** When the state became terminal */
    private Instant closedAt;

    @Builder.Default
    private List<EscalationRecord> history = new ArrayList<>();
}
