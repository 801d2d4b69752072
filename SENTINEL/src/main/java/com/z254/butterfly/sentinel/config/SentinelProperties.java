package com.z254.butterfly.sentinel.config;

import com.z254.butterfly.sentinel.domain.model.BusinessHours;
import com.z254.butterfly.sentinel.domain.model.ScoringWeights;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for SENTINEL.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Deduplication windows, thresholds and clustering</li>
 *     <li>Business impact scoring weights and revenue model</li>
 *     <li>Suppression, escalation and analytics housekeeping</li>
 *     <li>Enrichment timeouts, concurrency and caching</li>
 *     <li>Pipeline latency budget</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "sentinel")
public class SentinelProperties {

    @Valid
    private final Deduplication deduplication = new Deduplication();
    @Valid
    private final Scoring scoring = new Scoring();
    private final Suppression suppression = new Suppression();
    private final Escalation escalation = new Escalation();
    @Valid
    private final Enrichment enrichment = new Enrichment();
    @Valid
    private final Analytics analytics = new Analytics();
    private final Pipeline pipeline = new Pipeline();
    private BusinessHours businessHours = new BusinessHours();

    /**
     * Alert grouping configuration.
     */
    @Data
    public static class Deduplication {
        /** Groups accept alerts up to this long after their first member */
        private Duration timeWindow = Duration.ofMinutes(5);

        @Positive
        private int maxAlertsPerGroup = 100;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double similarityThreshold = 0.8;

        @NotEmpty
        private List<String> fingerprintFields = new ArrayList<>(List.of("source", "severity", "message"));

        private boolean clusteringEnabled = true;

        /** Upper bound on one clusterer call before falling back to rule-based matching */
        private Duration clusteringTimeout = Duration.ofMillis(100);

        @Positive
        private int clusteringThreads = 2;

        /** Pending clusterer calls beyond this are rejected and fall back immediately */
        @Positive
        private int clusteringQueueCapacity = 100;

        private Duration sweepInterval = Duration.ofMinutes(1);
    }

    /**
     * Business impact scoring configuration.
     */
    @Data
    public static class Scoring {
        private ScoringWeights weights = ScoringWeights.defaults();

        private RevenueModel revenueModel = RevenueModel.LOGARITHMIC;

        /** Revenue multiplier per service id, "default" applies to the rest */
        private Map<String, Double> revenueMultipliers = new HashMap<>(Map.of("default", 1.0));

        /** How long frequency history for a source/severity pair is kept */
        private Duration historyRetention = Duration.ofHours(24);

        private Duration historySweepInterval = Duration.ofMinutes(10);

        @Positive
        private int recentScoresSize = 1000;

        /** Scores above this raise a high impact notification */
        private double highImpactThreshold = 80.0;
    }

    public enum RevenueModel {
        LINEAR,
        EXPONENTIAL,
        LOGARITHMIC
    }

    /**
     * Suppression rule housekeeping.
     */
    @Data
    public static class Suppression {
        private int maintenanceRulePriority = 999;

        /** Frequency counters idle for longer than this are dropped */
        private Duration counterRetention = Duration.ofHours(24);

        private Duration sweepInterval = Duration.ofMinutes(1);
    }

    /**
     * Escalation configuration.
     */
    @Data
    public static class Escalation {
        private boolean enabled = true;

        private String defaultPolicyId = "default";

        @Positive
        private int maxSteps = 10;

        /** Active escalations older than this are resolved automatically */
        private Duration autoResolveAfter = Duration.ofHours(24);

        /** Terminal escalations are purged after this */
        private Duration retention = Duration.ofHours(24);

        private Duration sweepInterval = Duration.ofMinutes(5);

        @Positive
        private int schedulerPoolSize = 2;
    }

    /**
     * Analytics and pattern detection configuration.
     */
    @Data
    public static class Analytics {
        @Positive
        private int retentionDays = 30;

        /** Pattern detection look-back, in days */
        @Positive
        private int analysisWindowDays = 7;

        @Positive
        private int minOccurrences = 5;

        private Duration queryCacheTtl = Duration.ofMinutes(5);

        @Positive
        private int queryCacheSize = 500;

        private Duration sweepInterval = Duration.ofHours(1);
    }

    /**
     * Context enrichment configuration.
     */
    @Data
    public static class Enrichment {
        private boolean enabled = true;

        /** Upper bound on all lookups for one alert; slower lookups are cancelled */
        private Duration timeout = Duration.ofMillis(200);

        @Positive
        private int maxConcurrentEnrichments = 4;

        @Positive
        private int queueCapacity = 100;

        private boolean cacheEnabled = true;

        private Duration cacheTtl = Duration.ofMinutes(10);

        @Positive
        private int cacheSize = 1000;

        private Duration sweepInterval = Duration.ofMinutes(5);
    }

    /**
     * Pipeline orchestration configuration.
     */
    @Data
    public static class Pipeline {
        private Duration maxProcessingTime = Duration.ofMillis(500);

        /** Scores above this trigger escalation regardless of severity */
        private double escalationScoreThreshold = 80.0;
    }
}
