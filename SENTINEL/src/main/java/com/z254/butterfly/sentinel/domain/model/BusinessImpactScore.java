package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Importance of an alert in [1,100] together with the signals that produced it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusinessImpactScore {

    private String alertId;

    private double score;

    private Breakdown breakdown;

    /** Human-readable contributing factors */
    @Builder.Default
    private List<String> factors = new ArrayList<>();

    /** Share of signals backed by registered business data, in [0,1] */
    private double confidence;

    private Instant calculatedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Breakdown {
        private double severity;
        private double serviceImportance;
        private double userImpact;
        private double revenueImpact;
        private double frequency;
        private double duration;
    }
}
