package com.z254.butterfly.sentinel.escalation;

import com.z254.butterfly.sentinel.domain.model.Severity;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

@Value
@Builder
public class EscalationRequest {

    String alertId;

    Severity severity;

    String source;

    @Singular
    Set<String> tags;

    /** Null selects the configured default policy */
    String policyId;
}
