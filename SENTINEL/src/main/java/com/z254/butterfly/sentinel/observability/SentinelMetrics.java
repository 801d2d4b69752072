package com.z254.butterfly.sentinel.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics for SENTINEL.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Deduplication (groups, duplicates, suppression, clustering fallbacks)</li>
 *     <li>Scoring and rule-based suppression</li>
 *     <li>Escalation lifecycle and notification delivery</li>
 *     <li>Enrichment lookups and cache efficiency</li>
 *     <li>Pattern detection and pipeline latency</li>
 * </ul>
 */
@Component
public class SentinelMetrics {

    private final MeterRegistry meterRegistry;

    // Deduplication metrics
    @Getter
    private final Counter alertsDeduplicated;
    @Getter
    private final Counter groupsCreated;
    @Getter
    private final Counter groupsExpired;
    @Getter
    private final Counter alertsSuppressedByGroup;
    @Getter
    private final Counter clusteringFallbacks;

    // Scoring and suppression metrics
    private final DistributionSummary businessImpactScore;
    @Getter
    private final Counter alertsSuppressedByRule;

    // Escalation metrics
    @Getter
    private final Counter escalationsStarted;
    @Getter
    private final Counter escalationsAcknowledged;
    @Getter
    private final Counter escalationsExhausted;
    @Getter
    private final Counter notificationsSent;
    @Getter
    private final Counter notificationsFailed;
    private final Timer timeToAcknowledge;

    // Enrichment metrics
    @Getter
    private final Counter enrichmentLookups;
    @Getter
    private final Counter enrichmentCacheHits;
    @Getter
    private final Counter enrichmentFailures;

    // Analytics metrics
    @Getter
    private final Counter eventsRecorded;
    private final Map<String, Counter> patternsByType = new ConcurrentHashMap<>();

    // Pipeline metrics
    @Getter
    private final Counter alertsProcessed;
    @Getter
    private final Counter alertsRejected;
    @Getter
    private final Counter pipelineErrors;
    @Getter
    private final Counter budgetViolations;
    private final Timer pipelineLatency;

    public SentinelMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.alertsDeduplicated = Counter.builder("sentinel.dedup.duplicates")
                .description("Alerts that joined an existing group")
                .register(meterRegistry);
        this.groupsCreated = Counter.builder("sentinel.dedup.groups.created")
                .description("Alert groups created")
                .register(meterRegistry);
        this.groupsExpired = Counter.builder("sentinel.dedup.groups.expired")
                .description("Alert groups evicted after their window")
                .register(meterRegistry);
        this.alertsSuppressedByGroup = Counter.builder("sentinel.dedup.suppressed")
                .description("Alerts suppressed by deduplication")
                .register(meterRegistry);
        this.clusteringFallbacks = Counter.builder("sentinel.dedup.clustering.fallbacks")
                .description("Clusterer failures or timeouts that fell back to rule-based matching")
                .register(meterRegistry);

        this.businessImpactScore = DistributionSummary.builder("sentinel.scoring.score")
                .description("Business impact scores")
                .publishPercentiles(0.5, 0.75, 0.95)
                .register(meterRegistry);
        this.alertsSuppressedByRule = Counter.builder("sentinel.suppression.suppressed")
                .description("Alerts suppressed by suppression rules")
                .register(meterRegistry);

        this.escalationsStarted = Counter.builder("sentinel.escalations.started")
                .description("Escalations started")
                .register(meterRegistry);
        this.escalationsAcknowledged = Counter.builder("sentinel.escalations.acknowledged")
                .description("Escalations acknowledged")
                .register(meterRegistry);
        this.escalationsExhausted = Counter.builder("sentinel.escalations.exhausted")
                .description("Escalations that ran out of steps unacknowledged")
                .register(meterRegistry);
        this.notificationsSent = Counter.builder("sentinel.notifications.sent")
                .description("Escalation notifications delivered")
                .register(meterRegistry);
        this.notificationsFailed = Counter.builder("sentinel.notifications.failed")
                .description("Escalation notifications that failed to deliver")
                .register(meterRegistry);
        this.timeToAcknowledge = Timer.builder("sentinel.escalations.mtta")
                .description("Time from escalation start to acknowledgment")
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(meterRegistry);

        this.enrichmentLookups = Counter.builder("sentinel.enrichment.lookups")
                .description("Enrichment rule executions, cached or not")
                .register(meterRegistry);
        this.enrichmentCacheHits = Counter.builder("sentinel.enrichment.cache.hits")
                .description("Enrichment results served from cache")
                .register(meterRegistry);
        this.enrichmentFailures = Counter.builder("sentinel.enrichment.failures")
                .description("Enrichment lookups that failed or timed out")
                .register(meterRegistry);

        this.eventsRecorded = Counter.builder("sentinel.analytics.events")
                .description("Alert events recorded")
                .register(meterRegistry);

        this.alertsProcessed = Counter.builder("sentinel.pipeline.processed")
                .description("Alerts processed by the pipeline")
                .register(meterRegistry);
        this.alertsRejected = Counter.builder("sentinel.pipeline.rejected")
                .description("Alerts rejected by validation")
                .register(meterRegistry);
        this.pipelineErrors = Counter.builder("sentinel.pipeline.errors")
                .description("Pipeline stage failures")
                .register(meterRegistry);
        this.budgetViolations = Counter.builder("sentinel.pipeline.budget_exceeded")
                .description("Alerts whose processing exceeded the latency budget")
                .register(meterRegistry);
        this.pipelineLatency = Timer.builder("sentinel.pipeline.latency")
                .description("End-to-end processing latency per alert")
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(meterRegistry);
    }

    // ========== Deduplication Methods ==========

    public void recordGroupCreated() {
        groupsCreated.increment();
    }

    public void recordDuplicate() {
        alertsDeduplicated.increment();
    }

    public void recordGroupSuppression() {
        alertsSuppressedByGroup.increment();
    }

    public void recordGroupsExpired(int count) {
        groupsExpired.increment(count);
    }

    public void recordClusteringFallback() {
        clusteringFallbacks.increment();
    }

    // ========== Scoring / Suppression Methods ==========

    public void recordScore(double score) {
        businessImpactScore.record(score);
    }

    public void recordRuleSuppression(String ruleId) {
        alertsSuppressedByRule.increment();
        Counter.builder("sentinel.suppression.suppressed.by_rule")
                .tag("rule", ruleId)
                .register(meterRegistry)
                .increment();
    }

    // ========== Escalation Methods ==========

    public void recordEscalationStarted() {
        escalationsStarted.increment();
    }

    public void recordEscalationAcknowledged(Duration sinceStart) {
        escalationsAcknowledged.increment();
        timeToAcknowledge.record(sinceStart);
    }

    public void recordEscalationExhausted() {
        escalationsExhausted.increment();
    }

    public void recordNotifications(int sent, int failed) {
        notificationsSent.increment(sent);
        notificationsFailed.increment(failed);
    }

    // ========== Enrichment Methods ==========

    public void recordEnrichmentLookup(boolean cached) {
        enrichmentLookups.increment();
        if (cached) {
            enrichmentCacheHits.increment();
        }
    }

    public void recordEnrichmentFailure() {
        enrichmentFailures.increment();
    }

    // ========== Analytics Methods ==========

    public void recordEventRecorded() {
        eventsRecorded.increment();
    }

    public void recordPatternDetected(String patternType) {
        patternsByType.computeIfAbsent(patternType, type ->
                Counter.builder("sentinel.analytics.patterns")
                        .tag("pattern_type", type)
                        .description("Pattern detections by type")
                        .register(meterRegistry))
                .increment();
    }

    // ========== Pipeline Methods ==========

    public Timer.Sample startPipelineTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordAlertProcessed(Timer.Sample sample) {
        sample.stop(pipelineLatency);
        alertsProcessed.increment();
    }

    public void recordAlertRejected() {
        alertsRejected.increment();
    }

    public void recordPipelineError(String step) {
        pipelineErrors.increment();
        Counter.builder("sentinel.pipeline.errors.by_step")
                .tag("step", step)
                .register(meterRegistry)
                .increment();
    }

    public void recordBudgetViolation() {
        budgetViolations.increment();
    }
}
