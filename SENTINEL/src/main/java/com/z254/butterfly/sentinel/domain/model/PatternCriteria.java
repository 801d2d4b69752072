package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Matching criterion of a pattern. Which fields are populated depends on the {@link PatternType}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternCriteria {

    @Builder.Default
    private Set<String> sources = new HashSet<>();

    @Builder.Default
    private List<Severity> severities = new ArrayList<>();

    /** Peak hours of day (0-23), time-of-day patterns only */
    @Builder.Default
    private List<Integer> peakHours = new ArrayList<>();

    /** Occurrences per analysis window that triggered the pattern */
    private Integer frequencyThreshold;

    /** Correlated alert ids, cascading and escalation patterns only */
    @Builder.Default
    private List<String> correlatedAlertIds = new ArrayList<>();
}
