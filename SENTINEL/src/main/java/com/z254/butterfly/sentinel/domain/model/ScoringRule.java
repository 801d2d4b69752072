package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Operator adjustment applied on top of the weighted score.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoringRule {

    private String id;

    private String name;

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private int priority = 0;

    @Builder.Default
    private Set<String> sources = new HashSet<>();

    @Builder.Default
    private Set<Severity> severities = new HashSet<>();

    @Builder.Default
    private Set<String> tags = new HashSet<>();

    /** Only match inside (true) or outside (false) business hours; null ignores the clock */
    private Boolean businessHours;

    @Builder.Default
    private double multiplier = 1.0;

    @Builder.Default
    private double additive = 0.0;

    /** Replacement severity signal (0-100) per alert severity */
    @Builder.Default
    private Map<Severity, Double> severityOverrides = new EnumMap<>(Severity.class);

    public boolean matches(Alert alert, boolean inBusinessHours) {
        if (!enabled) {
            return false;
        }
        if (!sources.isEmpty() && !sources.contains(alert.getSource())) {
            return false;
        }
        if (!severities.isEmpty() && !severities.contains(alert.getSeverity())) {
            return false;
        }
        if (!tags.isEmpty() && (!alert.hasTags() || alert.getTags().stream().noneMatch(tags::contains))) {
            return false;
        }
        return businessHours == null || businessHours == inBusinessHours;
    }
}
