package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ordered list of escalation steps, with optional roles notified once every step is exhausted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationPolicy {

    private String id;

    private String name;

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private List<EscalationStep> steps = new ArrayList<>();

    @Builder.Default
    private List<String> fallbackRoleIds = new ArrayList<>();

    public List<EscalationStep> orderedSteps() {
        return steps.stream()
                .sorted(Comparator.comparingInt(EscalationStep::getOrder))
                .toList();
    }
}
