package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;

/**
 * Which alerts an enrichment rule applies to. Empty sets match everything.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrichmentConditions {

    @Builder.Default
    private Set<Severity> severities = new HashSet<>();

    @Builder.Default
    private Set<String> sources = new HashSet<>();

    /** Matches when the alert carries any of these tags; untagged alerts always match */
    @Builder.Default
    private Set<String> tags = new HashSet<>();

    /** True for business hours only, false for outside them, null for any time */
    private Boolean businessHours;
}
