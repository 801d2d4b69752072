package com.z254.butterfly.sentinel.domain.model;

import com.z254.butterfly.sentinel.exception.ScoringConfigurationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Relative weight of each scoring signal. Weights must be non-negative and sum to 1.0.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoringWeights {

    private static final double TOLERANCE = 1e-6;

    @Builder.Default
    private double severity = 0.25;

    @Builder.Default
    private double serviceImportance = 0.20;

    @Builder.Default
    private double userImpact = 0.20;

    @Builder.Default
    private double revenueImpact = 0.15;

    @Builder.Default
    private double frequency = 0.10;

    @Builder.Default
    private double duration = 0.10;

    public static ScoringWeights defaults() {
        return ScoringWeights.builder().build();
    }

    public double total() {
        return severity + serviceImportance + userImpact + revenueImpact + frequency + duration;
    }

    /**
     * @throws ScoringConfigurationException if any weight is negative or the sum is not 1.0
     */
    public ScoringWeights validate() {
        if (severity < 0 || serviceImportance < 0 || userImpact < 0
                || revenueImpact < 0 || frequency < 0 || duration < 0) {
            throw new ScoringConfigurationException("Scoring weights must not be negative: " + this);
        }
        double total = total();
        if (Math.abs(total - 1.0) > TOLERANCE) {
            throw new ScoringConfigurationException(
                    String.format("Scoring weights must sum to 1.0 but sum to %.6f: %s", total, this));
        }
        return this;
    }
}
