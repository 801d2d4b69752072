package com.z254.butterfly.sentinel.scoring;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class ScoringStats {

    long alertsScored;

    double averageScore;

    /** Counts per bucket: 0-20, 21-40, 41-60, 61-80, 81-100 */
    Map<String, Long> distribution;

    /** Scores above 80 */
    long highImpact;

    /** Scores from 50 to 80 */
    long mediumImpact;

    long lowImpact;
}
