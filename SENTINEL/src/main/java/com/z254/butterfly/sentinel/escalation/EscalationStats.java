package com.z254.butterfly.sentinel.escalation;

import com.z254.butterfly.sentinel.domain.model.Severity;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class EscalationStats {

    long total;

    long active;

    long acknowledged;

    long resolved;

    long cancelled;

    long exhausted;

    long notificationsSent;

    long notificationsFailed;

    double averageAcknowledgeMillis;

    double averageResolutionMillis;

    /** Acknowledgments per step index */
    Map<Integer, Long> acknowledgedByStep;

    Map<Severity, Long> bySeverity;
}
