package com.z254.butterfly.sentinel.domain.model;

public enum ServiceTier {
    CRITICAL(100),
    HIGH(75),
    MEDIUM(50),
    LOW(25);

    private final double score;

    ServiceTier(double score) {
        this.score = score;
    }

    public double score() {
        return score;
    }
}
