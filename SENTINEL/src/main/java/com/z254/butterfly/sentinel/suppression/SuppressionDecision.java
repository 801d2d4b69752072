package com.z254.butterfly.sentinel.suppression;

import com.z254.butterfly.sentinel.domain.model.SuppressionInstance;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SuppressionDecision {

    private static final SuppressionDecision PASS = SuppressionDecision.builder().suppressed(false).build();

    boolean suppressed;

    String ruleId;

    String ruleName;

    /** True when the matching rule belongs to a maintenance window */
    boolean maintenance;

    SuppressionInstance instance;

    String reason;

    public static SuppressionDecision notSuppressed() {
        return PASS;
    }
}
