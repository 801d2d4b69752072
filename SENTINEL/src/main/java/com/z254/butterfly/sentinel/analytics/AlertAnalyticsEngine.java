package com.z254.butterfly.sentinel.analytics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.z254.butterfly.sentinel.config.SentinelConfig;
import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.domain.model.AlertEvent;
import com.z254.butterfly.sentinel.domain.model.AlertEventType;
import com.z254.butterfly.sentinel.domain.model.AlertPattern;
import com.z254.butterfly.sentinel.domain.model.PatternStatus;
import com.z254.butterfly.sentinel.domain.model.Severity;
import com.z254.butterfly.sentinel.domain.repository.AlertEventStore;
import com.z254.butterfly.sentinel.event.SentinelEvent;
import com.z254.butterfly.sentinel.event.SentinelEventBus;
import com.z254.butterfly.sentinel.event.SentinelEventType;
import com.z254.butterfly.sentinel.exception.AnalyticsQueryException;
import com.z254.butterfly.sentinel.exception.SentinelException;
import com.z254.butterfly.sentinel.observability.SentinelMetrics;
import com.z254.butterfly.sentinel.observability.SentinelStructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Alert event history, pattern detection, ad-hoc queries, rolling metrics and insights.
 * <p>
 * Query results are cached by query value for {@code sentinel.analytics.query-cache-ttl}. New
 * events do not invalidate the cache; callers needing fresh data check
 * {@link AnalyticsResult#isCached()} or use a query with a different time range.
 */
@Slf4j
@Component
public class AlertAnalyticsEngine {

    static final double HIGH_VOLUME_PER_HOUR = 50.0;
    static final Duration SLOW_RESOLUTION = Duration.ofMinutes(30);
    static final int MANY_ACTIVE_PATTERNS = 5;
    static final int TOP_SOURCES = 10;
    static final int TOP_PATTERNS = 5;
    static final String CSV_HEADER = "timestamp,type,source,severity,businessImpactScore";

    private final SentinelProperties.Analytics config;
    private final AlertEventStore eventStore;
    private final SentinelEventBus eventBus;
    private final SentinelMetrics metrics;
    private final SentinelStructuredLogger structuredLogger;
    private final Clock clock;
    private final PatternDetector patternDetector;
    private final ObjectMapper exportMapper = SentinelConfig.exportObjectMapper();

    private static final DateTimeFormatter HOUR_KEY =
            DateTimeFormatter.ofPattern("yyyy-MM-dd-HH").withZone(ZoneOffset.UTC);

    private final Map<String, AlertPattern> patterns = new ConcurrentHashMap<>();
    private final Cache<AnalyticsQuery, AnalyticsResult> queryCache;

    public AlertAnalyticsEngine(SentinelProperties properties,
                                AlertEventStore eventStore,
                                SentinelEventBus eventBus,
                                SentinelMetrics metrics,
                                SentinelStructuredLogger structuredLogger,
                                Clock clock) {
        this.config = properties.getAnalytics();
        this.eventStore = eventStore;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
        this.patternDetector = new PatternDetector(config.getMinOccurrences());
        this.queryCache = Caffeine.newBuilder()
                .expireAfterWrite(config.getQueryCacheTtl())
                .maximumSize(config.getQueryCacheSize())
                .build();
    }

    // ========== Event Recording ==========

    /**
     * Append an event to the history and run pattern detection for it.
     * <p>
     * A missing id is generated; a missing timestamp is set to now.
     *
     * @return the event as stored
     */
    public AlertEvent recordEvent(AlertEvent event) {
        if (event.getAlertId() == null || event.getType() == null) {
            throw new IllegalArgumentException("Alert event requires alertId and type");
        }
        Instant now = clock.instant();
        AlertEvent stored = event.toBuilder()
                .id(event.getId() != null ? event.getId() : UUID.randomUUID().toString())
                .timestamp(event.getTimestamp() != null ? event.getTimestamp() : now)
                .build();
        eventStore.append(stored);
        metrics.recordEventRecorded();
        log.debug("Recorded {} event for alert {}", stored.getType(), stored.getAlertId());

        if (stored.getSource() != null) {
            detectPatterns(stored, now);
        }
        return stored;
    }

    // ========== Patterns ==========

    public List<AlertPattern> getPatterns() {
        return patterns.values().stream()
                .sorted(Comparator.comparing(AlertPattern::getConfidence).reversed()
                        .thenComparing(AlertPattern::getId))
                .toList();
    }

    public List<AlertPattern> getPatterns(PatternStatus status) {
        return getPatterns().stream()
                .filter(pattern -> pattern.getStatus() == status)
                .toList();
    }

    public Optional<AlertPattern> getPattern(String patternId) {
        return Optional.ofNullable(patterns.get(patternId));
    }

    /**
     * Set the operator status of a pattern. The status survives later re-detection.
     *
     * @return false when no such pattern exists
     */
    public boolean updatePatternStatus(String patternId, PatternStatus status) {
        AlertPattern updated = patterns.computeIfPresent(patternId,
                (id, pattern) -> pattern.toBuilder().status(status).build());
        if (updated != null) {
            log.info("Pattern {} marked {}", patternId, status);
        }
        return updated != null;
    }

    // ========== Queries ==========

    public AnalyticsResult query(AnalyticsQuery query) {
        validate(query);
        AnalyticsResult cached = queryCache.getIfPresent(query);
        if (cached != null) {
            return cached.toBuilder().cached(true).build();
        }

        List<AlertEvent> matching = eventStore.findSince(query.getFrom()).stream()
                .filter(event -> matches(query, event))
                .toList();

        List<AnalyticsMetric> requested = query.getMetrics().isEmpty()
                ? List.of(AnalyticsMetric.COUNT)
                : query.getMetrics();
        double spanHours = Math.max(1.0, Duration.between(query.getFrom(), query.getTo()).toMillis() / 3_600_000.0);

        Map<String, List<AlertEvent>> grouped = matching.stream()
                .collect(Collectors.groupingBy(event -> groupKey(query.getGroupBy(), event),
                        LinkedHashMap::new, Collectors.toList()));

        List<AnalyticsRow> rows = grouped.entrySet().stream()
                .map(entry -> AnalyticsRow.builder()
                        .key(entry.getKey())
                        .dimensions(dimensions(query.getGroupBy(), entry.getValue().get(0)))
                        .count(entry.getValue().size())
                        .values(metricValues(requested, entry.getValue(), spanHours))
                        .build())
                .sorted(Comparator.comparingLong(AnalyticsRow::getCount).reversed()
                        .thenComparing(AnalyticsRow::getKey))
                .toList();

        AnalyticsResult result = AnalyticsResult.builder()
                .query(query)
                .rows(rows)
                .aggregations(aggregate(matching))
                .totalEvents(matching.size())
                .executedAt(clock.instant())
                .cached(false)
                .build();
        queryCache.put(query, result);
        return result;
    }

    // ========== Metrics & Insights ==========

    /**
     * Metrics over the trailing 24 hours.
     */
    public AlertMetricsSnapshot getMetrics() {
        Instant now = clock.instant();
        List<AlertEvent> events = eventStore.findSince(now.minus(Duration.ofHours(24)));
        List<AlertEvent> created = ofType(events, AlertEventType.CREATED);
        if (events.isEmpty()) {
            return AlertMetricsSnapshot.empty(now);
        }

        List<AlertMetricsSnapshot.SourceCount> topSources = created.stream()
                .filter(event -> event.getSource() != null)
                .collect(Collectors.groupingBy(AlertEvent::getSource, Collectors.counting()))
                .entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_SOURCES)
                .map(entry -> new AlertMetricsSnapshot.SourceCount(entry.getKey(), entry.getValue()))
                .toList();

        List<String> problematic = patterns.values().stream()
                .filter(pattern -> pattern.getStatus() == PatternStatus.ACTIVE)
                .sorted(Comparator.comparingInt(AlertPattern::getOccurrences).reversed()
                        .thenComparing(AlertPattern::getId))
                .limit(TOP_PATTERNS)
                .map(AlertPattern::getId)
                .toList();

        long critical = created.stream().filter(event -> event.getSeverity() == Severity.CRITICAL).count();

        return AlertMetricsSnapshot.builder()
                .totalAlerts(created.size())
                .alertsPerHour(created.size() / 24.0)
                .alertsPerDay(created.size())
                .peakHour(peakHour(created))
                .mttrMillis(AlertStatistics.meanTimeToResolve(events).orElse(0.0))
                .mttaMillis(AlertStatistics.meanTimeToAcknowledge(events).orElse(0.0))
                .escalationRate(escalationRate(events))
                .suppressionRate(suppressionRate(events))
                .averageBusinessImpact(AlertStatistics.average(AlertStatistics.scores(events)))
                .criticalAlertRatio(AlertStatistics.percent(critical, created.size()))
                .topSources(new ArrayList<>(topSources))
                .problematicPatterns(new ArrayList<>(problematic))
                .calculatedAt(now)
                .build();
    }

    public List<AlertInsight> generateInsights() {
        AlertMetricsSnapshot snapshot = getMetrics();
        Instant now = clock.instant();
        List<AlertInsight> insights = new ArrayList<>();

        if (snapshot.getAlertsPerHour() > HIGH_VOLUME_PER_HOUR) {
            insights.add(AlertInsight.builder()
                    .id("high_alert_volume")
                    .level(InsightLevel.WARNING)
                    .title("High alert volume")
                    .description(String.format("%.1f alerts per hour over the last 24 hours", snapshot.getAlertsPerHour()))
                    .confidence(0.9)
                    .recommendations(List.of(
                            "Review alert thresholds",
                            "Add suppression rules for noisy sources"))
                    .generatedAt(now)
                    .build());
        }
        if (snapshot.getMttrMillis() > SLOW_RESOLUTION.toMillis()) {
            insights.add(AlertInsight.builder()
                    .id("slow_resolution")
                    .level(InsightLevel.CRITICAL)
                    .title("Slow alert resolution")
                    .description(String.format("Mean time to resolve is %.1f minutes", snapshot.getMttrMillis() / 60_000.0))
                    .confidence(0.85)
                    .recommendations(List.of(
                            "Review escalation policies",
                            "Add runbooks for the most frequent alerts"))
                    .generatedAt(now)
                    .build());
        }
        long activePatterns = patterns.values().stream()
                .filter(pattern -> pattern.getStatus() == PatternStatus.ACTIVE)
                .count();
        if (activePatterns > MANY_ACTIVE_PATTERNS) {
            insights.add(AlertInsight.builder()
                    .id("many_active_patterns")
                    .level(InsightLevel.WARNING)
                    .title("Many active alert patterns")
                    .description(activePatterns + " alert patterns are active")
                    .confidence(0.8)
                    .recommendations(List.of(
                            "Investigate the highest-confidence patterns first",
                            "Mark handled patterns as resolved or ignored"))
                    .generatedAt(now)
                    .build());
        }

        for (AlertInsight insight : insights) {
            eventBus.publish(SentinelEvent.builder()
                    .type(SentinelEventType.INSIGHT_GENERATED)
                    .timestamp(now)
                    .subjectId(insight.getId())
                    .attribute("level", insight.getLevel().name())
                    .build());
        }
        return insights;
    }

    // ========== Export ==========

    public String export(ExportFormat format) {
        List<AlertEvent> events = eventStore.findAll();
        if (format == ExportFormat.CSV) {
            return toCsv(events);
        }
        AnalyticsExport export = AnalyticsExport.builder()
                .exportedAt(clock.instant())
                .events(events)
                .patterns(getPatterns())
                .metrics(getMetrics())
                .build();
        try {
            return exportMapper.writeValueAsString(export);
        } catch (JsonProcessingException e) {
            throw new SentinelException("Failed to export analytics as JSON", e);
        }
    }

    // ========== Maintenance ==========

    /**
     * Drop events past {@code sentinel.analytics.retention-days}.
     */
    @Scheduled(fixedDelayString = "${sentinel.analytics.sweep-interval:PT1H}")
    public int pruneExpiredEvents() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(config.getRetentionDays()));
        int removed = eventStore.deleteOlderThan(cutoff);
        if (removed > 0) {
            log.info("Pruned {} alert events older than {}", removed, cutoff);
        }
        return removed;
    }

    @Scheduled(fixedDelayString = "${sentinel.analytics.query-cache-ttl:PT5M}")
    public void cleanUpCache() {
        queryCache.cleanUp();
    }

    public long cachedQueryCount() {
        return queryCache.estimatedSize();
    }

    public int eventCount() {
        return eventStore.size();
    }

    // ========== Private Methods ==========

    private void detectPatterns(AlertEvent event, Instant now) {
        List<AlertEvent> window = eventStore.findSince(now.minus(Duration.ofDays(config.getAnalysisWindowDays())));
        for (AlertPattern detected : patternDetector.detect(event, window, now)) {
            AlertPattern merged = patterns.merge(detected.getId(), detected,
                    (existing, fresh) -> fresh.toBuilder().status(existing.getStatus()).build());
            metrics.recordPatternDetected(merged.getType().name());
            structuredLogger.logPattern(merged.getId(), merged.getType().name(),
                    merged.getConfidence(), merged.getOccurrences());
            eventBus.publish(SentinelEvent.builder()
                    .type(SentinelEventType.PATTERN_DETECTED)
                    .timestamp(now)
                    .subjectId(merged.getId())
                    .alertId(event.getAlertId())
                    .attribute("patternType", merged.getType().name())
                    .attribute("confidence", merged.getConfidence())
                    .build());
        }
    }

    private void validate(AnalyticsQuery query) {
        if (query == null) {
            throw new IllegalArgumentException("Query must not be null");
        }
        if (query.getFrom() == null || query.getTo() == null) {
            throw new AnalyticsQueryException("Query requires both from and to", query);
        }
        if (query.getFrom().isAfter(query.getTo())) {
            throw new AnalyticsQueryException("Query 'from' is after 'to'", query);
        }
        if (query.getMinScore() != null && query.getMaxScore() != null
                && query.getMinScore() > query.getMaxScore()) {
            throw new AnalyticsQueryException("Query minScore exceeds maxScore", query);
        }
        if (query.getGroupBy().size() != Set.copyOf(query.getGroupBy()).size()) {
            throw new AnalyticsQueryException("Query repeats a groupBy dimension", query);
        }
    }

    private static boolean matches(AnalyticsQuery query, AlertEvent event) {
        if (event.getTimestamp().isAfter(query.getTo())) {
            return false;
        }
        if (!query.getSources().isEmpty() && !query.getSources().contains(event.getSource())) {
            return false;
        }
        if (!query.getSeverities().isEmpty() && !query.getSeverities().contains(event.getSeverity())) {
            return false;
        }
        if (!query.getEventTypes().isEmpty() && !query.getEventTypes().contains(event.getType())) {
            return false;
        }
        if (!query.getTags().isEmpty() && event.getTags().stream().noneMatch(query.getTags()::contains)) {
            return false;
        }
        if (event.hasScore()) {
            if (query.getMinScore() != null && event.getBusinessImpactScore() < query.getMinScore()) {
                return false;
            }
            if (query.getMaxScore() != null && event.getBusinessImpactScore() > query.getMaxScore()) {
                return false;
            }
        }
        return true;
    }

    private static String groupKey(List<GroupByDimension> groupBy, AlertEvent event) {
        if (groupBy.isEmpty()) {
            return "all";
        }
        return groupBy.stream()
                .map(dimension -> dimensionValue(dimension, event))
                .collect(Collectors.joining("|"));
    }

    private static Map<GroupByDimension, String> dimensions(List<GroupByDimension> groupBy, AlertEvent sample) {
        Map<GroupByDimension, String> values = new EnumMap<>(GroupByDimension.class);
        for (GroupByDimension dimension : groupBy) {
            values.put(dimension, dimensionValue(dimension, sample));
        }
        return values;
    }

    private static String dimensionValue(GroupByDimension dimension, AlertEvent event) {
        return switch (dimension) {
            case SOURCE -> String.valueOf(event.getSource());
            case SEVERITY -> String.valueOf(event.getSeverity());
            case TAG -> Optional.ofNullable(event.firstTag()).orElse("no-tag");
            case HOUR -> HOUR_KEY.format(event.getTimestamp());
            case DAY -> DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC).format(event.getTimestamp());
        };
    }

    private static Map<AnalyticsMetric, Double> metricValues(List<AnalyticsMetric> requested,
                                                             List<AlertEvent> events,
                                                             double spanHours) {
        Map<AnalyticsMetric, Double> values = new EnumMap<>(AnalyticsMetric.class);
        for (AnalyticsMetric metric : requested) {
            values.put(metric, metricValue(metric, events, spanHours));
        }
        return values;
    }

    private static double metricValue(AnalyticsMetric metric, List<AlertEvent> events, double spanHours) {
        return switch (metric) {
            case COUNT -> events.size();
            case MTTR -> AlertStatistics.meanTimeToResolve(events).orElse(0.0);
            case MTTA -> AlertStatistics.meanTimeToAcknowledge(events).orElse(0.0);
            case SCORE_AVG -> AlertStatistics.average(AlertStatistics.scores(events));
            case SCORE_P95 -> AlertStatistics.percentile(AlertStatistics.scores(events), 95);
            case FREQUENCY -> events.size() / spanHours;
            case ESCALATION_RATE -> escalationRate(events);
            case SUPPRESSION_RATE -> suppressionRate(events);
        };
    }

    private static QueryAggregations aggregate(List<AlertEvent> events) {
        List<AlertEvent> created = ofType(events, AlertEventType.CREATED);
        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        created.stream()
                .filter(event -> event.getSeverity() != null)
                .forEach(event -> bySeverity.merge(event.getSeverity(), 1L, Long::sum));
        Map<String, Long> byHour = created.stream()
                .collect(Collectors.groupingBy(
                        event -> String.format("%02d", event.getTimestamp().atZone(ZoneOffset.UTC).getHour()),
                        TreeMap::new, Collectors.counting()));

        return QueryAggregations.builder()
                .totalEvents(events.size())
                .uniqueSources(events.stream().map(AlertEvent::getSource).distinct().count())
                .severityDistribution(bySeverity)
                .hourlyDistribution(byHour)
                .averageBusinessImpact(AlertStatistics.average(AlertStatistics.scores(events)))
                .resolutionRate(AlertStatistics.percent(
                        AlertStatistics.countOfType(events, AlertEventType.RESOLVED), created.size()))
                .escalationRate(escalationRate(events))
                .suppressionRate(suppressionRate(events))
                .build();
    }

    /**
     * Escalated alerts per created alert, percent.
     */
    private static double escalationRate(Collection<AlertEvent> events) {
        long created = AlertStatistics.countOfType(events, AlertEventType.CREATED);
        long escalated = distinctAlerts(events, AlertEventType.ESCALATED);
        return Math.min(100.0, AlertStatistics.percent(escalated, created));
    }

    /**
     * Suppressed alerts never reach CREATED, so the denominator counts both outcomes.
     */
    private static double suppressionRate(Collection<AlertEvent> events) {
        long suppressed = AlertStatistics.countOfType(events, AlertEventType.SUPPRESSED);
        long created = AlertStatistics.countOfType(events, AlertEventType.CREATED);
        return AlertStatistics.percent(suppressed, suppressed + created);
    }

    private static long distinctAlerts(Collection<AlertEvent> events, AlertEventType type) {
        return events.stream()
                .filter(event -> event.getType() == type)
                .map(AlertEvent::getAlertId)
                .distinct()
                .count();
    }

    private static List<AlertEvent> ofType(List<AlertEvent> events, AlertEventType type) {
        return events.stream().filter(event -> event.getType() == type).toList();
    }

    private static int peakHour(List<AlertEvent> created) {
        return created.stream()
                .collect(Collectors.groupingBy(event -> event.getTimestamp().atZone(ZoneOffset.UTC).getHour(),
                        TreeMap::new, Collectors.counting()))
                .entrySet().stream()
                .max(Map.Entry.<Integer, Long>comparingByValue()
                        .thenComparing(Map.Entry.comparingByKey(Comparator.reverseOrder())))
                .map(Map.Entry::getKey)
                .orElse(-1);
    }

    private static String toCsv(List<AlertEvent> events) {
        StringBuilder csv = new StringBuilder(CSV_HEADER).append('\n');
        Function<Object, String> cell = value -> value == null ? "" : csvEscape(value.toString());
        for (AlertEvent event : events) {
            csv.append(cell.apply(event.getTimestamp())).append(',')
                    .append(cell.apply(event.getType())).append(',')
                    .append(cell.apply(event.getSource())).append(',')
                    .append(cell.apply(event.getSeverity())).append(',')
                    .append(cell.apply(event.getBusinessImpactScore()))
                    .append('\n');
        }
        return csv.toString();
    }

    private static String csvEscape(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return '"' + value.replace("\"", "\"\"") + '"';
        }
        return value;
    }
}
