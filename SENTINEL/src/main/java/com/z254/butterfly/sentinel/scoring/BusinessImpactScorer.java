package com.z254.butterfly.sentinel.scoring;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.domain.model.Alert;
import com.z254.butterfly.sentinel.domain.model.BusinessContext;
import com.z254.butterfly.sentinel.domain.model.BusinessHours;
import com.z254.butterfly.sentinel.domain.model.BusinessImpactScore;
import com.z254.butterfly.sentinel.domain.model.ScoringRule;
import com.z254.butterfly.sentinel.domain.model.ScoringWeights;
import com.z254.butterfly.sentinel.domain.repository.BusinessContextRepository;
import com.z254.butterfly.sentinel.event.SentinelEvent;
import com.z254.butterfly.sentinel.event.SentinelEventBus;
import com.z254.butterfly.sentinel.event.SentinelEventType;
import com.z254.butterfly.sentinel.observability.SentinelMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Scores alerts from 1 to 100 by business impact.
 * <p>
 * The score is a weighted sum of six 0-100 signals (severity, service importance, user impact,
 * revenue impact, frequency, duration), adjusted by operator scoring rules and clamped into
 * [1,100]. Services missing from the {@link BusinessContextRepository} get fixed conservative
 * signals: service 50, users 25, revenue 10.
 */
@Slf4j
@Component
public class BusinessImpactScorer {

    static final double DEFAULT_SERVICE_SCORE = 50.0;
    static final double DEFAULT_USER_SCORE = 25.0;
    static final double DEFAULT_REVENUE_SCORE = 10.0;
    static final double NO_HISTORY_FREQUENCY_SCORE = 20.0;
    static final double NO_DURATION_SCORE = 30.0;

    private static final String DEFAULT_MULTIPLIER_KEY = "default";

    private final SentinelProperties.Scoring config;
    private final BusinessHours businessHours;
    private final BusinessContextRepository contextRepository;
    private final SentinelEventBus eventBus;
    private final SentinelMetrics metrics;
    private final Clock clock;

    private volatile ScoringWeights weights;
    private final List<ScoringRule> rules = new CopyOnWriteArrayList<>();
    private final Map<String, FrequencyHistory> history = new ConcurrentHashMap<>();
    private final Cache<String, BusinessImpactScore> recentScores;

    // Stats
    private final AtomicLong alertsScored = new AtomicLong();
    private final DoubleAdder scoreSum = new DoubleAdder();
    private final Map<String, AtomicLong> distribution = new ConcurrentHashMap<>();

    public BusinessImpactScorer(SentinelProperties properties,
                                BusinessContextRepository contextRepository,
                                SentinelEventBus eventBus,
                                SentinelMetrics metrics,
                                Clock clock) {
        this.config = properties.getScoring();
        this.businessHours = properties.getBusinessHours();
        this.contextRepository = contextRepository;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.weights = config.getWeights().validate();
        this.recentScores = Caffeine.newBuilder()
                .maximumSize(config.getRecentScoresSize())
                .build();
        for (String bucket : List.of("0-20", "21-40", "41-60", "61-80", "81-100")) {
            distribution.put(bucket, new AtomicLong());
        }
        log.info("Business impact scorer initialized with weights {}", weights);
    }

    /**
     * Score an alert and record it in the frequency history.
     */
    public BusinessImpactScore score(Alert alert) {
        Instant now = clock.instant();
        boolean inBusinessHours = businessHours.contains(now);
        Optional<BusinessContext> context = contextRepository.findByServiceId(alert.getSource());
        FrequencyHistory previous = history.get(historyKey(alert));

        List<ScoringRule> matching = rules.stream()
                .filter(rule -> rule.matches(alert, inBusinessHours))
                .toList();

        BusinessImpactScore.Breakdown breakdown = BusinessImpactScore.Breakdown.builder()
                .severity(severitySignal(alert, matching))
                .serviceImportance(context.map(BusinessImpactScorer::serviceSignal).orElse(DEFAULT_SERVICE_SCORE))
                .userImpact(context.map(ctx -> userSignal(ctx, inBusinessHours)).orElse(DEFAULT_USER_SCORE))
                .revenueImpact(context.map(ctx -> revenueSignal(alert, ctx, inBusinessHours)).orElse(DEFAULT_REVENUE_SCORE))
                .frequency(frequencySignal(previous, alert.getTimestamp()))
                .duration(durationSignal(alert.getDuration()))
                .build();

        ScoringWeights w = weights;
        double total = breakdown.getSeverity() * w.getSeverity()
                + breakdown.getServiceImportance() * w.getServiceImportance()
                + breakdown.getUserImpact() * w.getUserImpact()
                + breakdown.getRevenueImpact() * w.getRevenueImpact()
                + breakdown.getFrequency() * w.getFrequency()
                + breakdown.getDuration() * w.getDuration();

        List<String> factors = new ArrayList<>();
        factors.add("severity=" + alert.getSeverity());
        context.ifPresent(ctx -> factors.add("tier=" + ctx.getTier()));
        if (inBusinessHours) {
            factors.add("businessHours");
        }
        for (ScoringRule rule : matching) {
            total = total * rule.getMultiplier() + rule.getAdditive();
            factors.add("rule=" + rule.getId());
        }
        double score = clamp(total);

        recordHistory(alert);
        BusinessImpactScore result = BusinessImpactScore.builder()
                .alertId(alert.getId())
                .score(score)
                .breakdown(breakdown)
                .factors(factors)
                .confidence(confidence(context.isPresent(), previous != null, alert.getDuration() != null))
                .calculatedAt(now)
                .build();

        recordStats(result);
        if (score > config.getHighImpactThreshold()) {
            eventBus.publish(SentinelEvent.builder()
                    .type(SentinelEventType.HIGH_IMPACT_ALERT)
                    .timestamp(now)
                    .subjectId(alert.getId())
                    .alertId(alert.getId())
                    .attribute("score", score)
                    .attribute("source", alert.getSource())
                    .build());
        }
        log.debug("Scored alert {} at {} ({})", alert.getId(), score, factors);
        return result;
    }

    /**
     * Replace the scoring weights.
     *
     * @throws com.z254.butterfly.sentinel.exception.ScoringConfigurationException if they do not sum to 1.0
     */
    public void updateWeights(ScoringWeights newWeights) {
        this.weights = newWeights.validate();
        log.info("Scoring weights updated to {}", newWeights);
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    public void addRule(ScoringRule rule) {
        rules.removeIf(existing -> existing.getId().equals(rule.getId()));
        rules.add(rule);
        rules.sort(Comparator.comparingInt(ScoringRule::getPriority).reversed());
    }

    public boolean removeRule(String ruleId) {
        return rules.removeIf(rule -> rule.getId().equals(ruleId));
    }

    public List<ScoringRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Highest recent scores first.
     */
    public List<BusinessImpactScore> getTopAlerts(int limit) {
        return recentScores.asMap().values().stream()
                .sorted(Comparator.comparingDouble(BusinessImpactScore::getScore).reversed())
                .limit(limit)
                .toList();
    }

    public Optional<BusinessImpactScore> getScore(String alertId) {
        return Optional.ofNullable(recentScores.getIfPresent(alertId));
    }

    public ScoringStats getStats() {
        long scored = alertsScored.get();
        Map<String, Long> buckets = new LinkedHashMap<>();
        distribution.entrySet().stream()
                .sorted(Map.Entry.comparingByKey(Comparator.comparingInt(key -> Integer.parseInt(key.split("-")[0]))))
                .forEach(entry -> buckets.put(entry.getKey(), entry.getValue().get()));
        List<BusinessImpactScore> recent = new ArrayList<>(recentScores.asMap().values());
        return ScoringStats.builder()
                .alertsScored(scored)
                .averageScore(scored > 0 ? scoreSum.sum() / scored : 0.0)
                .distribution(buckets)
                .highImpact(recent.stream().filter(s -> s.getScore() > 80).count())
                .mediumImpact(recent.stream().filter(s -> s.getScore() >= 50 && s.getScore() <= 80).count())
                .lowImpact(recent.stream().filter(s -> s.getScore() < 50).count())
                .build();
    }

    /**
     * Drop frequency history that has been idle longer than the retention.
     */
    @Scheduled(fixedDelayString = "${sentinel.scoring.history-sweep-interval:PT10M}")
    public int pruneHistory() {
        Instant cutoff = clock.instant().minus(config.getHistoryRetention());
        int before = history.size();
        history.entrySet().removeIf(entry -> entry.getValue().lastSeen().isBefore(cutoff));
        return before - history.size();
    }

    // ========== Signals ==========

    static double severitySignal(Alert alert, List<ScoringRule> matchingRules) {
        for (ScoringRule rule : matchingRules) {
            Double override = rule.getSeverityOverrides().get(alert.getSeverity());
            if (override != null) {
                return override;
            }
        }
        return switch (alert.getSeverity()) {
            case CRITICAL -> 100;
            case HIGH -> 75;
            case MEDIUM -> 50;
            case LOW -> 25;
        };
    }

    static double serviceSignal(BusinessContext context) {
        double score = context.getTier().score();
        BusinessContext.Sla sla = context.getSla();
        if (sla != null) {
            if (sla.getAvailability() > 99.9) score += 10;
            if (sla.getResponseTimeMillis() > 0 && sla.getResponseTimeMillis() < 100) score += 5;
            if (sla.getErrorRate() < 0.1) score += 5;
        }
        if (context.getDependencies() != null && context.getDependencies().size() > 5) {
            score += 10;
        }
        return Math.min(100, score);
    }

    static double userSignal(BusinessContext context, boolean inBusinessHours) {
        BusinessContext.UserBase users = context.getUsers();
        if (users == null || users.getTotal() <= 0) {
            return DEFAULT_USER_SCORE;
        }
        double score = (double) users.getAffected() / users.getTotal() * 100;
        if (users.getAffected() > 0 && users.getVip() > 0) {
            score += (double) users.getVip() / users.getAffected() * 50;
        }
        if (inBusinessHours) {
            score *= 1.5;
        }
        return Math.min(100, score);
    }

    double revenueSignal(Alert alert, BusinessContext context, boolean inBusinessHours) {
        double revenueAtRisk = revenueAtRisk(alert, context, inBusinessHours);
        if (revenueAtRisk <= 0) {
            return DEFAULT_REVENUE_SCORE;
        }
        return switch (config.getRevenueModel()) {
            case LINEAR -> Math.min(100, revenueAtRisk / 10_000 * 100);
            case EXPONENTIAL -> Math.min(100, Math.sqrt(revenueAtRisk / 1_000) * 20);
            case LOGARITHMIC -> Math.min(100, Math.log10(revenueAtRisk + 1) * 25);
        };
    }

    double revenueAtRisk(Alert alert, BusinessContext context, boolean inBusinessHours) {
        BusinessContext.Revenue revenue = context.getRevenue();
        if (revenue == null || revenue.getHourly() <= 0) {
            return 0;
        }
        double hours = alert.getDuration() != null ? alert.getDuration().toMillis() / 3_600_000.0 : 1.0;
        Map<String, Double> multipliers = config.getRevenueMultipliers();
        double multiplier = multipliers.getOrDefault(context.getServiceId(),
                multipliers.getOrDefault(DEFAULT_MULTIPLIER_KEY, 1.0));
        double atRisk = revenue.getHourly() * hours * multiplier;
        return inBusinessHours ? atRisk * 2 : atRisk;
    }

    /**
     * Alerts per hour for this source and severity before the current alert.
     */
    static double frequencySignal(FrequencyHistory previous, Instant at) {
        if (previous == null) {
            return NO_HISTORY_FREQUENCY_SCORE;
        }
        double hours = Math.max(1.0, Duration.between(previous.firstSeen(), at).toMillis() / 3_600_000.0);
        double perHour = previous.count() / hours;
        if (perHour > 10) return 100;
        if (perHour > 5) return 75;
        if (perHour > 2) return 50;
        if (perHour > 0.5) return 25;
        return 10;
    }

    static double durationSignal(Duration duration) {
        if (duration == null) {
            return NO_DURATION_SCORE;
        }
        double hours = duration.toMillis() / 3_600_000.0;
        if (hours > 4) return 100;
        if (hours > 2) return 75;
        if (hours > 1) return 50;
        if (hours > 0.5) return 25;
        return 10;
    }

    // ========== Private Methods ==========

    private static double clamp(double score) {
        return Math.max(1.0, Math.min(100.0, score));
    }

    private static double confidence(boolean hasContext, boolean hasHistory, boolean hasDuration) {
        int backed = 1 + (hasContext ? 3 : 0) + (hasHistory ? 1 : 0) + (hasDuration ? 1 : 0);
        return backed / 6.0;
    }

    private void recordHistory(Alert alert) {
        history.merge(historyKey(alert),
                new FrequencyHistory(alert.getTimestamp(), alert.getTimestamp(), 1),
                (existing, fresh) -> new FrequencyHistory(
                        existing.firstSeen(),
                        fresh.lastSeen().isAfter(existing.lastSeen()) ? fresh.lastSeen() : existing.lastSeen(),
                        existing.count() + 1));
    }

    private void recordStats(BusinessImpactScore result) {
        alertsScored.incrementAndGet();
        scoreSum.add(result.getScore());
        distribution.get(bucket(result.getScore())).incrementAndGet();
        if (result.getAlertId() != null) {
            recentScores.put(result.getAlertId(), result);
        }
        metrics.recordScore(result.getScore());
    }

    private static String bucket(double score) {
        if (score <= 20) return "0-20";
        if (score <= 40) return "21-40";
        if (score <= 60) return "41-60";
        if (score <= 80) return "61-80";
        return "81-100";
    }

    private static String historyKey(Alert alert) {
        return alert.getSource() + "|" + alert.getSeverity();
    }

    record FrequencyHistory(Instant firstSeen, Instant lastSeen, long count) {
    }
}
