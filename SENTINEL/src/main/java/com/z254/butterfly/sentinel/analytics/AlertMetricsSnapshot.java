package com.z254.butterfly.sentinel.analytics;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Rolling metrics over the last 24 hours of events.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertMetricsSnapshot {

    /** Created events in the last 24 hours */
    private long totalAlerts;

    private double alertsPerHour;

    private double alertsPerDay;

    /** UTC hour (0-23) with most created events, -1 without events */
    private int peakHour;

    private double mttrMillis;

    private double mttaMillis;

    private double escalationRate;

    private double suppressionRate;

    private double averageBusinessImpact;

    /** Share of created alerts that were critical, percent */
    private double criticalAlertRatio;

    @Builder.Default
    private List<SourceCount> topSources = new ArrayList<>();

    /** Ids of the most frequent active patterns */
    @Builder.Default
    private List<String> problematicPatterns = new ArrayList<>();

    private Instant calculatedAt;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SourceCount {
        private String source;
        private long count;
    }

    public static AlertMetricsSnapshot empty(Instant at) {
        return AlertMetricsSnapshot.builder().peakHour(-1).calculatedAt(at).build();
    }
}
