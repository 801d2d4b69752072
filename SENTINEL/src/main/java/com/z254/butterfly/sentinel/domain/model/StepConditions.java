package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;

/**
 * Applicability filter of an escalation step. Empty sets match everything.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepConditions {

    @Builder.Default
    private Set<Severity> severities = new HashSet<>();

    @Builder.Default
    private Set<String> sources = new HashSet<>();

    @Builder.Default
    private Set<String> tags = new HashSet<>();

    public boolean matches(Severity severity, String source, Set<String> alertTags) {
        if (!severities.isEmpty() && !severities.contains(severity)) {
            return false;
        }
        if (!sources.isEmpty() && !sources.contains(source)) {
            return false;
        }
        if (!tags.isEmpty()) {
            return alertTags != null && alertTags.stream().anyMatch(tags::contains);
        }
        return true;
    }
}
