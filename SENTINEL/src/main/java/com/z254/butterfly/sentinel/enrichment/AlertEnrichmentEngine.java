package com.z254.butterfly.sentinel.enrichment;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.domain.model.Alert;
import com.z254.butterfly.sentinel.domain.model.BusinessHours;
import com.z254.butterfly.sentinel.domain.model.EnrichmentConditions;
import com.z254.butterfly.sentinel.domain.model.EnrichmentRule;
import com.z254.butterfly.sentinel.domain.model.EnrichmentType;
import com.z254.butterfly.sentinel.event.SentinelEvent;
import com.z254.butterfly.sentinel.event.SentinelEventBus;
import com.z254.butterfly.sentinel.event.SentinelEventType;
import com.z254.butterfly.sentinel.observability.SentinelMetrics;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Gathers context for alerts from registered {@link EnrichmentSource}s.
 * <p>
 * Every enabled rule whose conditions match the alert runs one lookup. Lookups run concurrently
 * on a bounded pool and share a single deadline per alert; lookups still running at the deadline
 * are cancelled and reported as errors. Results are cached per rule, source, severity and
 * time bucket of the rule's window.
 */
@Slf4j
@Component
public class AlertEnrichmentEngine {

    private final SentinelProperties.Enrichment config;
    private final BusinessHours businessHours;
    private final SentinelEventBus eventBus;
    private final SentinelMetrics metrics;
    private final Clock clock;
    private final AsyncTaskExecutor executor;
    private final Validator validator;

    private final Map<String, EnrichmentSource> sources = new ConcurrentHashMap<>();
    private final Map<String, EnrichmentRule> rules = new ConcurrentHashMap<>();
    private final Cache<String, EnrichedData> cache;

    // Stats
    private final AtomicLong totalEnrichments = new AtomicLong();
    private final AtomicLong enrichmentsWithErrors = new AtomicLong();
    private final AtomicLong enrichmentNanos = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final Map<EnrichmentType, AtomicLong> enrichmentsByType = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> enrichmentsBySource = new ConcurrentHashMap<>();

    public AlertEnrichmentEngine(SentinelProperties properties,
                                 List<EnrichmentSource> sources,
                                 SentinelEventBus eventBus,
                                 SentinelMetrics metrics,
                                 Clock clock,
                                 @Qualifier("enrichmentTaskExecutor") AsyncTaskExecutor executor,
                                 Validator validator) {
        this.config = properties.getEnrichment();
        this.businessHours = properties.getBusinessHours();
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.executor = executor;
        this.validator = validator;
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.getCacheSize())
                .expireAfterWrite(config.getCacheTtl())
                .build();
        sources.forEach(this::registerSource);
    }

    // ========== Enrichment ==========

    /**
     * Run every applicable rule against the alert. Never throws for a failing source.
     */
    public EnrichmentResult enrich(Alert alert) {
        List<EnrichmentRule> applicable = rules.values().stream()
                .filter(rule -> rule.isEnabled() && applies(rule.getConditions(), alert))
                .sorted(Comparator.comparing(EnrichmentRule::getId))
                .toList();
        if (applicable.isEmpty()) {
            log.debug("No applicable enrichment rules for alert {}", alert.getId());
        }

        EnrichmentResult result = run(alert, applicable);
        recordStats(result);
        if (result.hasData()) {
            eventBus.publish(SentinelEvent.builder()
                    .type(SentinelEventType.ALERT_ENRICHED)
                    .timestamp(clock.instant())
                    .subjectId(alert.getId())
                    .alertId(alert.getId())
                    .attribute("enrichments", result.getEnrichedData().size())
                    .attribute("errors", result.getErrors().size())
                    .build());
        }
        return result;
    }

    /**
     * Run a single rule regardless of its conditions. Statistics are not updated.
     *
     * @throws IllegalArgumentException when no rule with that id is registered
     */
    public EnrichmentResult testRule(String ruleId, Alert alert) {
        EnrichmentRule rule = getRule(ruleId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown enrichment rule: " + ruleId));
        return run(alert, List.of(rule));
    }

    // ========== Registry ==========

    public void registerSource(EnrichmentSource source) {
        sources.put(source.getId(), source);
        log.info("Registered enrichment source {}", source.getId());
    }

    /**
     * Register or replace a rule.
     *
     * @throws IllegalArgumentException listing the violated constraints of the rule
     */
    public EnrichmentRule registerRule(EnrichmentRule rule) {
        Set<ConstraintViolation<EnrichmentRule>> violations = validator.validate(rule);
        if (!violations.isEmpty()) {
            throw new IllegalArgumentException("Invalid enrichment rule " + rule.getId() + ": "
                    + violations.stream().map(ConstraintViolation::getMessage).sorted().collect(Collectors.joining("; ")));
        }
        if (rule.getId() == null) {
            rule.setId("enrich_rule_" + UUID.randomUUID());
        }
        if (rule.getConditions() == null) {
            rule.setConditions(EnrichmentConditions.builder().build());
        }
        rules.put(rule.getId(), rule);
        log.info("Registered enrichment rule {} ({}) on source {}", rule.getId(), rule.getName(), rule.getSourceId());
        return rule;
    }

    public boolean removeRule(String ruleId) {
        return rules.remove(ruleId) != null;
    }

    public Optional<EnrichmentRule> getRule(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    public List<EnrichmentRule> getRules() {
        List<EnrichmentRule> all = new ArrayList<>(rules.values());
        all.sort(Comparator.comparing(EnrichmentRule::getId));
        return all;
    }

    public List<EnrichmentSource> getSources() {
        List<EnrichmentSource> all = new ArrayList<>(sources.values());
        all.sort(Comparator.comparing(EnrichmentSource::getId));
        return all;
    }

    // ========== Stats & Cache ==========

    public EnrichmentStats getStats() {
        long total = totalEnrichments.get();
        long hits = cacheHits.get();
        long lookups = hits + cacheMisses.get();
        Map<EnrichmentType, Long> byType = new EnumMap<>(EnrichmentType.class);
        enrichmentsByType.forEach((type, count) -> byType.put(type, count.get()));
        Map<String, Long> bySource = new TreeMap<>();
        enrichmentsBySource.forEach((source, count) -> bySource.put(source, count.get()));
        return EnrichmentStats.builder()
                .totalEnrichments(total)
                .enrichmentsByType(byType)
                .enrichmentsBySource(bySource)
                .averageEnrichmentMillis(total > 0 ? enrichmentNanos.get() / 1e6 / total : 0.0)
                .cacheHitRate(lookups > 0 ? (double) hits / lookups : 0.0)
                .errorRate(total > 0 ? (double) enrichmentsWithErrors.get() / total : 0.0)
                .cachedEntries(cache.estimatedSize())
                .build();
    }

    public void clearCache() {
        cache.invalidateAll();
        log.info("Enrichment cache cleared");
    }

    @Scheduled(fixedDelayString = "${sentinel.enrichment.sweep-interval:PT5M}")
    public void cleanUpCache() {
        cache.cleanUp();
    }

    // ========== Private Methods ==========

    private EnrichmentResult run(Alert alert, List<EnrichmentRule> applicable) {
        long start = System.nanoTime();
        long deadline = start + config.getTimeout().toNanos();
        EnrichmentResult.EnrichmentResultBuilder result = EnrichmentResult.builder().alertId(alert.getId());
        int hits = 0;
        int misses = 0;

        List<PendingLookup> pending = new ArrayList<>();
        for (EnrichmentRule rule : applicable) {
            String cacheKey = cacheKey(alert, rule);
            EnrichedData cached = config.isCacheEnabled() ? cache.getIfPresent(cacheKey) : null;
            if (cached != null) {
                hits++;
                metrics.recordEnrichmentLookup(true);
                result.enrichment(cached.toBuilder().cached(true).build());
                continue;
            }
            EnrichmentSource source = sources.get(rule.getSourceId());
            if (source == null || !source.isEnabled()) {
                result.error(failure(rule, "Enrichment source not found or disabled: " + rule.getSourceId()));
                continue;
            }
            try {
                pending.add(new PendingLookup(rule, cacheKey, executor.submit(() -> lookup(source, alert, rule))));
                misses++;
                metrics.recordEnrichmentLookup(false);
            } catch (RuntimeException e) {
                result.error(failure(rule, "Enrichment pool rejected lookup: " + e.getMessage()));
            }
        }

        boolean interrupted = false;
        for (PendingLookup lookup : pending) {
            if (interrupted) {
                lookup.future().cancel(true);
                result.error(failure(lookup.rule(), "interrupted"));
                continue;
            }
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                EnrichedData data = lookup.future().get(remaining, TimeUnit.NANOSECONDS);
                if (config.isCacheEnabled()) {
                    cache.put(lookup.cacheKey(), data);
                }
                result.enrichment(data);
            } catch (TimeoutException e) {
                lookup.future().cancel(true);
                result.error(failure(lookup.rule(), "timed out after " + config.getTimeout().toMillis() + "ms"));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                result.error(failure(lookup.rule(), String.valueOf(cause.getMessage())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                lookup.future().cancel(true);
                result.error(failure(lookup.rule(), "interrupted"));
            }
        }

        return result
                .processingTime(Duration.ofNanos(System.nanoTime() - start))
                .cacheHits(hits)
                .cacheMisses(misses)
                .build();
    }

    private EnrichedData lookup(EnrichmentSource source, Alert alert, EnrichmentRule rule) {
        long start = System.nanoTime();
        String query = buildQuery(alert, rule.getQueryTemplate());
        SourceLookup lookup = source.lookup(alert, rule, query);
        if (lookup == null) {
            throw new IllegalStateException("Enrichment source " + source.getId() + " returned no result");
        }
        return EnrichedData.builder()
                .ruleId(rule.getId())
                .sourceId(source.getId())
                .type(rule.getType())
                .timestamp(clock.instant())
                .data(lookup.getData())
                .query(query)
                .resultCount(lookup.getResultCount())
                .executionTime(Duration.ofNanos(System.nanoTime() - start))
                .cached(false)
                .summary(lookup.getSummary())
                .build();
    }

    private boolean applies(EnrichmentConditions conditions, Alert alert) {
        if (!conditions.getSeverities().isEmpty() && !conditions.getSeverities().contains(alert.getSeverity())) {
            return false;
        }
        if (!conditions.getSources().isEmpty() && !conditions.getSources().contains(alert.getSource())) {
            return false;
        }
        if (!conditions.getTags().isEmpty() && alert.hasTags()
                && conditions.getTags().stream().noneMatch(alert.getTags()::contains)) {
            return false;
        }
        return conditions.getBusinessHours() == null
                || conditions.getBusinessHours() == businessHours.contains(alert.getTimestamp());
    }

    static String buildQuery(Alert alert, String template) {
        if (template == null) {
            return null;
        }
        String tags = alert.hasTags() ? String.join(",", new TreeSet<>(alert.getTags())) : "";
        return template
                .replace("{{alert.source}}", String.valueOf(alert.getSource()))
                .replace("{{alert.severity}}", alert.getSeverity().name().toLowerCase(Locale.ROOT))
                .replace("{{alert.message}}", String.valueOf(alert.getMessage()))
                .replace("{{alert.timestamp}}", alert.getTimestamp().toString())
                .replace("{{alert.tags}}", tags);
    }

    private String cacheKey(Alert alert, EnrichmentRule rule) {
        long bucket = alert.getTimestamp().toEpochMilli() / rule.getTimeWindow().toMillis();
        return rule.getId() + "|" + alert.getSource() + "|" + alert.getSeverity() + "|" + bucket;
    }

    private EnrichmentError failure(EnrichmentRule rule, String message) {
        metrics.recordEnrichmentFailure();
        log.warn("Enrichment rule {} on source {} failed: {}", rule.getId(), rule.getSourceId(), message);
        return new EnrichmentError(rule.getId(), rule.getSourceId(), message, clock.instant());
    }

    private void recordStats(EnrichmentResult result) {
        totalEnrichments.incrementAndGet();
        enrichmentNanos.addAndGet(result.getProcessingTime().toNanos());
        cacheHits.addAndGet(result.getCacheHits());
        cacheMisses.addAndGet(result.getCacheMisses());
        if (result.hasErrors()) {
            enrichmentsWithErrors.incrementAndGet();
        }
        for (EnrichedData data : result.getEnrichedData()) {
            enrichmentsByType.computeIfAbsent(data.getType(), type -> new AtomicLong()).incrementAndGet();
            enrichmentsBySource.computeIfAbsent(data.getSourceId(), source -> new AtomicLong()).incrementAndGet();
        }
    }

    private record PendingLookup(EnrichmentRule rule, String cacheKey, Future<EnrichedData> future) {
    }
}
