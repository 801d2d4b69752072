package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuppressionConditions {

    @Builder.Default
    private Set<String> sources = new HashSet<>();

    @Builder.Default
    private Set<Severity> severities = new HashSet<>();

    /** Matches when the alert carries any of these tags */
    @Builder.Default
    private Set<String> tags = new HashSet<>();

    /** Case-insensitive regular expression over the message */
    private String messagePattern;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    private SuppressionSchedule schedule;

    private FrequencyLimit frequency;
}
