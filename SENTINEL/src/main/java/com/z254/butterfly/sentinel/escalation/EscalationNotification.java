package com.z254.butterfly.sentinel.escalation;

import com.z254.butterfly.sentinel.domain.model.Severity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Channel-agnostic payload handed to a {@link NotificationDispatcher}.
 */
@Value
@Builder
public class EscalationNotification {

    String escalationId;

    String alertId;

    String policyId;

    /** Step index, or -1 for the fallback notification after exhaustion */
    int step;

    String roleId;

    Severity severity;

    String source;

    String subject;

    Instant createdAt;
}
