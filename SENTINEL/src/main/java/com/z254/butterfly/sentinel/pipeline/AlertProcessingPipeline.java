package com.z254.butterfly.sentinel.pipeline;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.z254.butterfly.sentinel.analytics.AlertAnalyticsEngine;
import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.dedup.AlertDeduplicationEngine;
import com.z254.butterfly.sentinel.dedup.DeduplicationResult;
import com.z254.butterfly.sentinel.domain.model.Alert;
import com.z254.butterfly.sentinel.domain.model.AlertEvent;
import com.z254.butterfly.sentinel.domain.model.AlertEventType;
import com.z254.butterfly.sentinel.domain.model.BusinessImpactScore;
import com.z254.butterfly.sentinel.domain.model.PatternStatus;
import com.z254.butterfly.sentinel.domain.model.Severity;
import com.z254.butterfly.sentinel.enrichment.AlertEnrichmentEngine;
import com.z254.butterfly.sentinel.enrichment.EnrichmentResult;
import com.z254.butterfly.sentinel.escalation.EscalationManager;
import com.z254.butterfly.sentinel.escalation.EscalationRequest;
import com.z254.butterfly.sentinel.event.SentinelEvent;
import com.z254.butterfly.sentinel.event.SentinelEventBus;
import com.z254.butterfly.sentinel.event.SentinelEventType;
import com.z254.butterfly.sentinel.exception.AlertValidationException;
import com.z254.butterfly.sentinel.observability.SentinelMetrics;
import com.z254.butterfly.sentinel.observability.SentinelStructuredLogger;
import com.z254.butterfly.sentinel.observability.SentinelStructuredLogger.AlertLogEvent;
import com.z254.butterfly.sentinel.scoring.BusinessImpactScorer;
import com.z254.butterfly.sentinel.suppression.AlertSuppressionEngine;
import com.z254.butterfly.sentinel.suppression.SuppressionDecision;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Runs each alert through validation, deduplication, scoring, rule suppression, enrichment,
 * escalation and analytics, in that order.
 * <p>
 * Validation and deduplication failures abort the alert. Failures in the later steps are
 * recorded on the {@link ProcessedAlert} and processing continues with the next step.
 * Suppression at either the group or the rule level ends processing early with a
 * {@code SUPPRESSED} analytics event.
 */
@Slf4j
@Service
public class AlertProcessingPipeline {

    static final double DEGRADED_ERROR_RATE = 10.0;
    static final double UNHEALTHY_ERROR_RATE = 50.0;
    private static final long RECENT_ALERTS_SIZE = 10_000;

    private final SentinelProperties properties;
    private final AlertValidator validator;
    private final AlertDeduplicationEngine deduplicationEngine;
    private final BusinessImpactScorer scorer;
    private final AlertSuppressionEngine suppressionEngine;
    private final AlertEnrichmentEngine enrichmentEngine;
    private final EscalationManager escalationManager;
    private final AlertAnalyticsEngine analyticsEngine;
    private final SentinelEventBus eventBus;
    private final SentinelMetrics metrics;
    private final SentinelStructuredLogger structuredLogger;
    private final Clock clock;

    /** Source and severity of recently processed alerts, for acknowledge/resolve events */
    private final Cache<String, Alert> recentAlerts;

    // Stats
    private final AtomicLong totalAlerts = new AtomicLong();
    private final AtomicLong rejectedAlerts = new AtomicLong();
    private final AtomicLong suppressedAlerts = new AtomicLong();
    private final AtomicLong escalatedAlerts = new AtomicLong();
    private final AtomicLong alertsWithErrors = new AtomicLong();
    private final AtomicLong budgetViolations = new AtomicLong();
    private final AtomicLong processingNanos = new AtomicLong();
    private final Map<PipelineStep, AtomicLong> stepNanos = new ConcurrentHashMap<>();

    public AlertProcessingPipeline(SentinelProperties properties,
                                   AlertValidator validator,
                                   AlertDeduplicationEngine deduplicationEngine,
                                   BusinessImpactScorer scorer,
                                   AlertSuppressionEngine suppressionEngine,
                                   AlertEnrichmentEngine enrichmentEngine,
                                   EscalationManager escalationManager,
                                   AlertAnalyticsEngine analyticsEngine,
                                   SentinelEventBus eventBus,
                                   SentinelMetrics metrics,
                                   SentinelStructuredLogger structuredLogger,
                                   Clock clock) {
        this.properties = properties;
        this.validator = validator;
        this.deduplicationEngine = deduplicationEngine;
        this.scorer = scorer;
        this.suppressionEngine = suppressionEngine;
        this.enrichmentEngine = enrichmentEngine;
        this.escalationManager = escalationManager;
        this.analyticsEngine = analyticsEngine;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
        this.recentAlerts = Caffeine.newBuilder()
                .maximumSize(RECENT_ALERTS_SIZE)
                .expireAfterWrite(properties.getEscalation().getRetention())
                .build();
        for (PipelineStep step : PipelineStep.values()) {
            stepNanos.put(step, new AtomicLong());
        }
    }

    // ========== Processing ==========

    /**
     * Process a single alert.
     *
     * @throws AlertValidationException when the alert is malformed; no engine state is touched
     */
    public ProcessedAlert process(Alert alert) {
        Timer.Sample sample = metrics.startPipelineTimer();
        long start = System.nanoTime();
        ProcessedAlert.ProcessedAlertBuilder result = ProcessedAlert.builder();

        timed(PipelineStep.VALIDATION, result, () -> {
            try {
                validator.validate(alert);
            } catch (AlertValidationException e) {
                rejectedAlerts.incrementAndGet();
                metrics.recordAlertRejected();
                structuredLogger.logAlertEvent(e.getAlertId(), AlertLogEvent.REJECTED,
                        "Alert rejected", Map.of("violations", e.getViolations()));
                throw e;
            }
            return null;
        });
        totalAlerts.incrementAndGet();
        alert.setMetadata(alert.getMetadata() != null ? new HashMap<>(alert.getMetadata()) : new HashMap<>());
        structuredLogger.logAlertEvent(alert.getId(), AlertLogEvent.RECEIVED, "Alert received",
                Map.of("source", alert.getSource(), "severity", alert.getSeverity().name()));

        try (SentinelStructuredLogger.MDCScope ignored = structuredLogger.withContext(
                Map.of(SentinelStructuredLogger.MDC_ALERT_ID, alert.getId(),
                        SentinelStructuredLogger.MDC_COMPONENT, "pipeline"))) {
            runSteps(alert, result);
        }

        recentAlerts.put(alert.getId(), alert);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        processingNanos.addAndGet(elapsed.toNanos());
        metrics.recordAlertProcessed(sample);
        result.alert(alert).processingTime(elapsed);

        Duration budget = properties.getPipeline().getMaxProcessingTime();
        if (elapsed.compareTo(budget) > 0) {
            budgetViolations.incrementAndGet();
            metrics.recordBudgetViolation();
            structuredLogger.logPerformance("alert-pipeline", elapsed, budget, Map.of("alertId", alert.getId()));
            eventBus.publish(SentinelEvent.builder()
                    .type(SentinelEventType.PERFORMANCE_BUDGET_EXCEEDED)
                    .timestamp(clock.instant())
                    .subjectId(alert.getId())
                    .alertId(alert.getId())
                    .attribute("elapsedMillis", elapsed.toMillis())
                    .attribute("budgetMillis", budget.toMillis())
                    .build());
            result.budgetExceeded(true);
        }

        ProcessedAlert processed = result.build();
        if (processed.hasErrors()) {
            alertsWithErrors.incrementAndGet();
        }
        if (processed.isSuppressed()) {
            suppressedAlerts.incrementAndGet();
        }
        structuredLogger.logAlertEvent(alert.getId(), AlertLogEvent.PROCESSED, "Alert processed",
                Map.of("suppressed", processed.isSuppressed(),
                        "groupId", String.valueOf(processed.getGroupId()),
                        "durationMs", elapsed.toMillis()));
        return processed;
    }

    /**
     * Process a batch in order. Malformed alerts are logged and skipped.
     */
    public List<ProcessedAlert> processAll(List<Alert> alerts) {
        List<ProcessedAlert> results = new ArrayList<>(alerts.size());
        for (Alert alert : alerts) {
            try {
                results.add(process(alert));
            } catch (AlertValidationException e) {
                log.warn("Skipping invalid alert in batch: {}", e.getMessage());
            }
        }
        return results;
    }

    /**
     * Acknowledge an alert: halts its escalation and records an ACKNOWLEDGED event.
     *
     * @return true when an active escalation was acknowledged
     */
    public boolean acknowledge(String alertId, String acknowledgedBy) {
        boolean acknowledged = escalationManager.acknowledgeAlert(alertId, acknowledgedBy);
        recordLifecycleEvent(alertId, AlertEventType.ACKNOWLEDGED, "acknowledgedBy", acknowledgedBy);
        return acknowledged;
    }

    /**
     * Resolve an alert: closes its escalation and records a RESOLVED event.
     *
     * @return true when an escalation was resolved
     */
    public boolean resolve(String alertId, String resolvedBy) {
        boolean resolved = escalationManager.resolveAlert(alertId, resolvedBy);
        recordLifecycleEvent(alertId, AlertEventType.RESOLVED, "resolvedBy", resolvedBy);
        return resolved;
    }

    // ========== Stats & Health ==========

    public PipelineStats getStats() {
        long total = totalAlerts.get();
        Map<PipelineStep, Double> averageSteps = new EnumMap<>(PipelineStep.class);
        stepNanos.forEach((step, nanos) -> averageSteps.put(step, total > 0 ? nanos.get() / 1e6 / total : 0.0));
        return PipelineStats.builder()
                .totalAlerts(total)
                .rejectedAlerts(rejectedAlerts.get())
                .suppressedAlerts(suppressedAlerts.get())
                .escalatedAlerts(escalatedAlerts.get())
                .alertsWithErrors(alertsWithErrors.get())
                .budgetViolations(budgetViolations.get())
                .averageProcessingMillis(total > 0 ? processingNanos.get() / 1e6 / total : 0.0)
                .errorRate(total > 0 ? (double) alertsWithErrors.get() / total * 100.0 : 0.0)
                .averageStepMillis(averageSteps)
                .build();
    }

    public PipelineHealth getHealth() {
        PipelineStats stats = getStats();
        PipelineHealth.Status status;
        if (stats.getErrorRate() > UNHEALTHY_ERROR_RATE) {
            status = PipelineHealth.Status.UNHEALTHY;
        } else if (stats.getErrorRate() > DEGRADED_ERROR_RATE
                || stats.getAverageProcessingMillis() > properties.getPipeline().getMaxProcessingTime().toMillis()) {
            status = PipelineHealth.Status.DEGRADED;
        } else {
            status = PipelineHealth.Status.HEALTHY;
        }
        return PipelineHealth.builder()
                .status(status)
                .errorRate(stats.getErrorRate())
                .averageProcessingMillis(stats.getAverageProcessingMillis())
                .activeGroups(deduplicationEngine.activeGroupCount())
                .activeEscalations(escalationManager.getActiveEscalations().size())
                .retainedEvents(analyticsEngine.eventCount())
                .activePatterns(analyticsEngine.getPatterns(PatternStatus.ACTIVE).size())
                .build();
    }

    // ========== Private Methods ==========

    private void runSteps(Alert alert, ProcessedAlert.ProcessedAlertBuilder result) {
        DeduplicationResult dedup = timed(PipelineStep.DEDUPLICATION, result, () -> deduplicationEngine.process(alert));
        result.isNew(dedup.isNew())
                .groupId(dedup.getGroupId())
                .similarAlerts(dedup.getSimilarAlerts());
        if (!dedup.isNew()) {
            structuredLogger.logAlertEvent(alert.getId(), AlertLogEvent.GROUPED, "Alert joined group",
                    Map.of("groupId", String.valueOf(dedup.getGroupId()),
                            "matchType", String.valueOf(dedup.getMatchType()),
                            "count", alert.getCount()));
        }
        if (dedup.isSuppressed()) {
            result.suppressed(true).suppressionReason("Deduplicated into suppressed group " + dedup.getGroupId());
            recordAnalytics(alert, AlertEventType.SUPPRESSED, null, result);
            logSuppressed(alert, "group");
            return;
        }

        BusinessImpactScore score = optionalStep(PipelineStep.SCORING, alert, result, () -> scorer.score(alert));
        if (score != null) {
            alert.getMetadata().put(Alert.METADATA_SCORE, score.getScore());
            result.score(score);
            structuredLogger.logAlertEvent(alert.getId(), AlertLogEvent.SCORED, "Alert scored",
                    Map.of("score", score.getScore()));
        }

        SuppressionDecision decision = optionalStep(PipelineStep.SUPPRESSION, alert, result, () -> suppressionEngine.evaluate(alert));
        if (decision != null && decision.isSuppressed()) {
            alert.setSuppressed(true);
            result.suppressed(true).suppressionReason(decision.getReason());
            recordAnalytics(alert, AlertEventType.SUPPRESSED, score, result);
            logSuppressed(alert, decision.getRuleId());
            return;
        }

        EnrichmentResult enrichment = null;
        if (properties.getEnrichment().isEnabled()) {
            enrichment = optionalStep(PipelineStep.ENRICHMENT, alert, result, () -> enrichmentEngine.enrich(alert));
            if (enrichment != null) {
                result.enrichment(enrichment);
                if (enrichment.hasData()) {
                    structuredLogger.logAlertEvent(alert.getId(), AlertLogEvent.ENRICHED, "Alert enriched",
                            Map.of("enrichments", enrichment.getEnrichedData().size(),
                                    "errors", enrichment.getErrors().size()));
                }
            }
        }

        String escalationId = null;
        if (shouldEscalate(alert, score, dedup.isNew())) {
            escalationId = optionalStep(PipelineStep.ESCALATION, alert, result, () -> escalationManager.startEscalation(
                    EscalationRequest.builder()
                            .alertId(alert.getId())
                            .severity(alert.getSeverity())
                            .source(alert.getSource())
                            .tags(alert.getTags() != null ? alert.getTags() : List.of())
                            .build())
                    .map(state -> state.getId())
                    .orElse(null));
            if (escalationId != null) {
                escalatedAlerts.incrementAndGet();
                result.escalationId(escalationId);
                structuredLogger.logAlertEvent(alert.getId(), AlertLogEvent.ESCALATED, "Alert escalated",
                        Map.of("escalationId", escalationId));
            }
        }

        recordAnalytics(alert, AlertEventType.CREATED, score, result);
        if (enrichment != null && enrichment.hasData()) {
            recordAnalytics(alert, AlertEventType.ENRICHED, score, result);
        }
        if (escalationId != null) {
            recordAnalytics(alert, AlertEventType.ESCALATED, score, result);
        }
    }

    private boolean shouldEscalate(Alert alert, BusinessImpactScore score, boolean newGroup) {
        if (!properties.getEscalation().isEnabled()) {
            return false;
        }
        return alert.getSeverity() == Severity.CRITICAL
                || (score != null && score.getScore() > properties.getPipeline().getEscalationScoreThreshold())
                || (newGroup && alert.getSeverity() == Severity.HIGH);
    }

    private void recordAnalytics(Alert alert, AlertEventType type, BusinessImpactScore score,
                                 ProcessedAlert.ProcessedAlertBuilder result) {
        optionalStep(PipelineStep.ANALYTICS, alert, result, () -> analyticsEngine.recordEvent(AlertEvent.builder()
                .alertId(alert.getId())
                .timestamp(clock.instant())
                .type(type)
                .source(alert.getSource())
                .severity(alert.getSeverity())
                .duration(alert.getDuration())
                .tags(alert.getTags() != null ? alert.getTags() : List.of())
                .metadataEntry("groupId", String.valueOf(alert.getGroupId()))
                .businessImpactScore(score != null ? score.getScore() : null)
                .build()));
    }

    private void recordLifecycleEvent(String alertId, AlertEventType type, String actorKey, String actor) {
        Optional<Alert> known = Optional.ofNullable(recentAlerts.getIfPresent(alertId));
        AlertEvent.AlertEventBuilder event = AlertEvent.builder()
                .alertId(alertId)
                .timestamp(clock.instant())
                .type(type)
                .metadataEntry(actorKey, String.valueOf(actor));
        known.ifPresent(alert -> event.source(alert.getSource()).severity(alert.getSeverity()));
        try {
            analyticsEngine.recordEvent(event.build());
        } catch (RuntimeException e) {
            metrics.recordPipelineError(PipelineStep.ANALYTICS.name());
            log.error("Failed to record {} event for alert {}", type, alertId, e);
        }
    }

    private void logSuppressed(Alert alert, String by) {
        structuredLogger.logAlertEvent(alert.getId(), AlertLogEvent.SUPPRESSED, "Alert suppressed",
                Map.of("by", String.valueOf(by)));
    }

    private <T> T timed(PipelineStep step, ProcessedAlert.ProcessedAlertBuilder result, Supplier<T> action) {
        long start = System.nanoTime();
        try {
            return action.get();
        } finally {
            long nanos = System.nanoTime() - start;
            stepNanos.get(step).addAndGet(nanos);
            result.stepTiming(step, Duration.ofNanos(nanos));
        }
    }

    /**
     * Run a step whose failure must not stop the pipeline.
     *
     * @return the step's value, or null when it failed
     */
    private <T> T optionalStep(PipelineStep step, Alert alert, ProcessedAlert.ProcessedAlertBuilder result,
                               Supplier<T> action) {
        try {
            return timed(step, result, action);
        } catch (RuntimeException e) {
            metrics.recordPipelineError(step.name());
            result.error(step.name().toLowerCase() + ": " + e.getMessage());
            structuredLogger.logAlertEvent(alert.getId(), AlertLogEvent.STEP_FAILED, "Pipeline step failed",
                    Map.of("step", step.name(), "error", String.valueOf(e.getMessage())));
            log.debug("Step {} failure detail", step, e);
            return null;
        }
    }
}
