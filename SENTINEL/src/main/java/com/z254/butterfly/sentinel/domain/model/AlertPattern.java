package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A recurring condition detected over the alert event history.
 * <p>
 * Identified by a deterministic id such as {@code high_freq_<source>}; later detection passes
 * overwrite the same entry.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlertPattern {

    private String id;

    private String name;

    private String description;

    private PatternType type;

    private PatternCriteria criteria;

    /** Confidence in [0,1] */
    private double confidence;

    private int occurrences;

    private Instant lastSeen;

    private PatternImpact impact;

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    @Builder.Default
    private PatternStatus status = PatternStatus.ACTIVE;
}
