package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternImpact {

    private double averageBusinessImpact;

    /** Average resolution time in milliseconds, 0 when nothing resolved */
    private double averageResolutionMillis;

    /** Percentage of affected alerts that escalated */
    private double escalationRate;
}
