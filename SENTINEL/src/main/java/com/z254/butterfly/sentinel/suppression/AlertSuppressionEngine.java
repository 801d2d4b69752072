package com.z254.butterfly.sentinel.suppression;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.domain.model.Alert;
import com.z254.butterfly.sentinel.domain.model.BusinessHours;
import com.z254.butterfly.sentinel.domain.model.FrequencyLimit;
import com.z254.butterfly.sentinel.domain.model.MaintenanceWindow;
import com.z254.butterfly.sentinel.domain.model.MaintenanceWindowStatus;
import com.z254.butterfly.sentinel.domain.model.SuppressionAction;
import com.z254.butterfly.sentinel.domain.model.SuppressionConditions;
import com.z254.butterfly.sentinel.domain.model.SuppressionInstance;
import com.z254.butterfly.sentinel.domain.model.SuppressionRule;
import com.z254.butterfly.sentinel.domain.model.SuppressionSchedule;
import com.z254.butterfly.sentinel.domain.model.SuppressionStatus;
import com.z254.butterfly.sentinel.domain.model.SuppressionType;
import com.z254.butterfly.sentinel.domain.model.TimeInterval;
import com.z254.butterfly.sentinel.event.SentinelEvent;
import com.z254.butterfly.sentinel.event.SentinelEventBus;
import com.z254.butterfly.sentinel.event.SentinelEventType;
import com.z254.butterfly.sentinel.observability.SentinelMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Rule-based suppression, independent of deduplication.
 * <p>
 * Rules are evaluated by descending priority, then registration order; the first matching rule
 * wins. Maintenance window rules match every alert from the affected services inside the window,
 * critical alerts included. This deliberately overrides the deduplication guarantee that critical
 * alerts are never suppressed.
 */
@Slf4j
@Component
public class AlertSuppressionEngine {

    static final String MAINTENANCE_RULE_PREFIX = "maint_rule_";

    private final SentinelProperties.Suppression config;
    private final BusinessHours businessHours;
    private final SentinelEventBus eventBus;
    private final SentinelMetrics metrics;
    private final Clock clock;

    private final List<RegisteredRule> rules = new CopyOnWriteArrayList<>();
    private final AtomicLong registrationSequence = new AtomicLong();
    private final Map<String, SuppressionInstance> instances = new ConcurrentHashMap<>();
    private final Map<String, MaintenanceWindow> maintenanceWindows = new ConcurrentHashMap<>();
    private final Map<String, FrequencyCounter> counters = new ConcurrentHashMap<>();

    private final AtomicLong alertsEvaluated = new AtomicLong();
    private final AtomicLong alertsSuppressed = new AtomicLong();
    private final Map<String, AtomicLong> suppressionsByRule = new ConcurrentHashMap<>();

    public AlertSuppressionEngine(SentinelProperties properties,
                                  SentinelEventBus eventBus,
                                  SentinelMetrics metrics,
                                  Clock clock) {
        this.config = properties.getSuppression();
        this.businessHours = properties.getBusinessHours();
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Evaluate the rules against an alert. The first match creates a suppression instance.
     */
    public SuppressionDecision evaluate(Alert alert) {
        alertsEvaluated.incrementAndGet();
        for (RegisteredRule registered : rules) {
            if (matches(registered, alert, false)) {
                return suppress(registered.rule(), alert);
            }
        }
        return SuppressionDecision.notSuppressed();
    }

    /**
     * Dry run of one rule: no instance is created and frequency counters are not advanced.
     */
    public boolean testRule(String ruleId, Alert alert) {
        RegisteredRule registered = findRegistered(ruleId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown suppression rule: " + ruleId));
        return matches(registered, alert, true);
    }

    // ========== Rule Management ==========

    /**
     * Register or replace a rule. A replaced rule keeps its registration position.
     */
    public SuppressionRule addRule(SuppressionRule rule) {
        if (rule.getId() == null) {
            rule.setId("rule_" + UUID.randomUUID());
        }
        if (rule.getCreatedAt() == null) {
            rule.setCreatedAt(clock.instant());
        }
        Pattern messagePattern = compile(rule.getConditions());
        long sequence = findRegistered(rule.getId())
                .map(RegisteredRule::sequence)
                .orElseGet(registrationSequence::incrementAndGet);
        synchronized (rules) {
            rules.removeIf(existing -> existing.rule().getId().equals(rule.getId()));
            rules.add(new RegisteredRule(rule, sequence, messagePattern));
            rules.sort(RegisteredRule.EVALUATION_ORDER);
        }
        log.info("Registered suppression rule {} ({}) with priority {}", rule.getId(), rule.getName(), rule.getPriority());
        return rule;
    }

    /**
     * Replace an existing rule, keeping its registration position and creation time.
     *
     * @throws IllegalArgumentException when no rule with that id is registered
     */
    public SuppressionRule updateRule(SuppressionRule rule) {
        SuppressionRule existing = getRule(rule.getId())
                .orElseThrow(() -> new IllegalArgumentException("Unknown suppression rule: " + rule.getId()));
        rule.setCreatedAt(existing.getCreatedAt());
        return addRule(rule);
    }

    public boolean removeRule(String ruleId) {
        boolean removed;
        synchronized (rules) {
            removed = rules.removeIf(existing -> existing.rule().getId().equals(ruleId));
        }
        counters.keySet().removeIf(key -> key.startsWith(ruleId + "|"));
        return removed;
    }

    public Optional<SuppressionRule> getRule(String ruleId) {
        return findRegistered(ruleId).map(RegisteredRule::rule);
    }

    /**
     * Rules in evaluation order.
     */
    public List<SuppressionRule> getRules() {
        return rules.stream().map(RegisteredRule::rule).toList();
    }

    // ========== Maintenance Windows ==========

    /**
     * Register a maintenance window and its suppression rule.
     */
    public MaintenanceWindow scheduleMaintenanceWindow(MaintenanceWindow window) {
        if (window.getStart() == null || window.getEnd() == null || !window.getEnd().isAfter(window.getStart())) {
            throw new IllegalArgumentException("Maintenance window needs a start before its end: " + window);
        }
        if (window.getId() == null) {
            window.setId("maint_" + UUID.randomUUID());
        }
        Instant now = clock.instant();
        window.setStatus(now.isBefore(window.getStart())
                ? MaintenanceWindowStatus.SCHEDULED
                : now.isBefore(window.getEnd()) ? MaintenanceWindowStatus.ACTIVE : MaintenanceWindowStatus.COMPLETED);
        maintenanceWindows.put(window.getId(), window);

        if (window.getStatus() != MaintenanceWindowStatus.COMPLETED) {
            addRule(maintenanceRule(window));
        }
        log.info("Maintenance window {} ({}) scheduled {} - {}, status {}",
                window.getId(), window.getName(), window.getStart(), window.getEnd(), window.getStatus());
        return window;
    }

    public boolean cancelMaintenanceWindow(String windowId) {
        MaintenanceWindow window = maintenanceWindows.get(windowId);
        if (window == null || window.getStatus() == MaintenanceWindowStatus.COMPLETED) {
            return false;
        }
        window.setStatus(MaintenanceWindowStatus.CANCELLED);
        removeRule(MAINTENANCE_RULE_PREFIX + windowId);
        publishMaintenance(SentinelEventType.MAINTENANCE_ENDED, window);
        return true;
    }

    public List<MaintenanceWindow> getMaintenanceWindows() {
        return maintenanceWindows.values().stream()
                .sorted(Comparator.comparing(MaintenanceWindow::getStart))
                .toList();
    }

    // ========== Suppression Instances ==========

    public boolean cancelSuppression(String instanceId) {
        SuppressionInstance instance = instances.get(instanceId);
        if (instance == null || instance.getStatus() != SuppressionStatus.ACTIVE) {
            return false;
        }
        instance.setStatus(SuppressionStatus.CANCELLED);
        log.info("Suppression {} cancelled", instanceId);
        return true;
    }

    public List<SuppressionInstance> getActiveSuppressions() {
        Instant now = clock.instant();
        return instances.values().stream()
                .filter(instance -> instance.getStatus() == SuppressionStatus.ACTIVE)
                .filter(instance -> instance.getExpiresAt() == null || now.isBefore(instance.getExpiresAt()))
                .sorted(Comparator.comparing(SuppressionInstance::getSuppressedAt))
                .toList();
    }

    public SuppressionStats getStats() {
        Map<String, Long> byRule = new ConcurrentHashMap<>();
        suppressionsByRule.forEach((ruleId, count) -> byRule.put(ruleId, count.get()));
        return SuppressionStats.builder()
                .totalRules(rules.size())
                .enabledRules((int) rules.stream().filter(r -> r.rule().isEnabled()).count())
                .alertsEvaluated(alertsEvaluated.get())
                .alertsSuppressed(alertsSuppressed.get())
                .activeSuppressions(getActiveSuppressions().size())
                .activeMaintenanceWindows(maintenanceWindows.values().stream()
                        .filter(w -> w.getStatus() == MaintenanceWindowStatus.ACTIVE).count())
                .suppressionsByRule(byRule)
                .build();
    }

    /**
     * Advance maintenance windows, expire suppression instances and drop idle frequency counters.
     */
    @Scheduled(fixedDelayString = "${sentinel.suppression.sweep-interval:PT1M}")
    public void sweep() {
        Instant now = clock.instant();

        for (MaintenanceWindow window : new ArrayList<>(maintenanceWindows.values())) {
            if (window.getStatus() == MaintenanceWindowStatus.SCHEDULED && !now.isBefore(window.getStart())
                    && now.isBefore(window.getEnd())) {
                window.setStatus(MaintenanceWindowStatus.ACTIVE);
                publishMaintenance(SentinelEventType.MAINTENANCE_STARTED, window);
            }
            if ((window.getStatus() == MaintenanceWindowStatus.SCHEDULED
                    || window.getStatus() == MaintenanceWindowStatus.ACTIVE) && !now.isBefore(window.getEnd())) {
                window.setStatus(MaintenanceWindowStatus.COMPLETED);
                removeRule(MAINTENANCE_RULE_PREFIX + window.getId());
                publishMaintenance(SentinelEventType.MAINTENANCE_ENDED, window);
            }
        }

        Instant retentionCutoff = now.minus(config.getCounterRetention());
        for (SuppressionInstance instance : new ArrayList<>(instances.values())) {
            if (instance.getStatus() == SuppressionStatus.ACTIVE && instance.getExpiresAt() != null
                    && !now.isBefore(instance.getExpiresAt())) {
                instance.setStatus(SuppressionStatus.EXPIRED);
            }
            if (instance.getStatus() != SuppressionStatus.ACTIVE && instance.getSuppressedAt().isBefore(retentionCutoff)) {
                instances.remove(instance.getId());
            }
        }
        counters.entrySet().removeIf(entry -> entry.getValue().lastSeen().isBefore(retentionCutoff));
    }

    // ========== Private Methods ==========

    private SuppressionDecision suppress(SuppressionRule rule, Alert alert) {
        Instant now = clock.instant();
        SuppressionAction action = rule.getAction();
        String reason = "Suppressed by rule " + rule.getName();
        SuppressionInstance instance = SuppressionInstance.builder()
                .id("supp_" + UUID.randomUUID())
                .ruleId(rule.getId())
                .alertId(alert.getId())
                .source(alert.getSource())
                .suppressedAt(now)
                .expiresAt(expiry(action, now))
                .reason(reason)
                .build();
        instances.put(instance.getId(), instance);

        alertsSuppressed.incrementAndGet();
        suppressionsByRule.computeIfAbsent(rule.getId(), id -> new AtomicLong()).incrementAndGet();
        metrics.recordRuleSuppression(rule.getId());

        if (action.isNotifyOnSuppression()) {
            eventBus.publish(SentinelEvent.builder()
                    .type(SentinelEventType.RULE_SUPPRESSED)
                    .timestamp(now)
                    .subjectId(rule.getId())
                    .alertId(alert.getId())
                    .attribute("instanceId", instance.getId())
                    .attribute("reason", reason)
                    .build());
        }
        log.debug("Alert {} suppressed by rule {}", alert.getId(), rule.getId());

        return SuppressionDecision.builder()
                .suppressed(true)
                .ruleId(rule.getId())
                .ruleName(rule.getName())
                .maintenance(rule.getMaintenanceWindowId() != null)
                .instance(instance)
                .reason(reason)
                .build();
    }

    private static Instant expiry(SuppressionAction action, Instant now) {
        if (action.getType() != SuppressionType.TEMPORARY) {
            return null;
        }
        if (action.getEndTime() != null) {
            return action.getEndTime();
        }
        return action.getDuration() != null ? now.plus(action.getDuration()) : null;
    }

    private boolean matches(RegisteredRule registered, Alert alert, boolean dryRun) {
        SuppressionRule rule = registered.rule();
        if (!rule.isEnabled()) {
            return false;
        }
        SuppressionConditions conditions = rule.getConditions();
        if (conditions == null) {
            return true;
        }
        if (!conditions.getSources().isEmpty() && !conditions.getSources().contains(alert.getSource())) {
            return false;
        }
        if (!conditions.getSeverities().isEmpty() && !conditions.getSeverities().contains(alert.getSeverity())) {
            return false;
        }
        if (!conditions.getTags().isEmpty()
                && (!alert.hasTags() || alert.getTags().stream().noneMatch(conditions.getTags()::contains))) {
            return false;
        }
        if (registered.messagePattern() != null
                && (alert.getMessage() == null || !registered.messagePattern().matcher(alert.getMessage()).find())) {
            return false;
        }
        if (!metadataMatches(conditions.getMetadata(), alert.getMetadata())) {
            return false;
        }
        if (conditions.getSchedule() != null && !scheduleMatches(conditions.getSchedule(), alert.getTimestamp())) {
            return false;
        }
        if (conditions.getFrequency() != null) {
            return exceedsFrequency(rule.getId(), conditions.getFrequency(), alert, dryRun);
        }
        return true;
    }

    private static boolean metadataMatches(Map<String, Object> expected, Map<String, Object> actual) {
        if (expected == null || expected.isEmpty()) {
            return true;
        }
        if (actual == null) {
            return false;
        }
        return expected.entrySet().stream()
                .allMatch(entry -> Objects.equals(entry.getValue(), actual.get(entry.getKey())));
    }

    private boolean scheduleMatches(SuppressionSchedule schedule, Instant at) {
        if (!schedule.getMaintenanceWindows().isEmpty()
                && schedule.getMaintenanceWindows().stream().noneMatch(window -> window.contains(at))) {
            return false;
        }
        if (schedule.getBusinessHours() != null && schedule.getBusinessHours() != businessHours.contains(at)) {
            return false;
        }
        ZonedDateTime local = at.atZone(schedule.getTimezone());
        if (!schedule.getDays().isEmpty() && !schedule.getDays().contains(local.getDayOfWeek())) {
            return false;
        }
        return schedule.getTimeRanges().isEmpty()
                || schedule.getTimeRanges().stream().anyMatch(range -> range.contains(local.toLocalTime()));
    }

    /**
     * Counts the alert against the rule's window; true once more than {@code maxAlerts} arrived.
     */
    private boolean exceedsFrequency(String ruleId, FrequencyLimit limit, Alert alert, boolean dryRun) {
        String key = ruleId + "|" + alert.getSource() + "|" + alert.getSeverity();
        Instant at = alert.getTimestamp();
        if (dryRun) {
            FrequencyCounter current = counters.get(key);
            int count = current == null || current.expired(at, limit) ? 1 : current.count() + 1;
            return count > limit.getMaxAlerts();
        }
        FrequencyCounter updated = counters.compute(key, (k, current) ->
                current == null || current.expired(at, limit)
                        ? new FrequencyCounter(at, at, 1)
                        : new FrequencyCounter(current.windowStart(), at, current.count() + 1));
        return updated.count() > limit.getMaxAlerts();
    }

    private SuppressionRule maintenanceRule(MaintenanceWindow window) {
        return SuppressionRule.builder()
                .id(MAINTENANCE_RULE_PREFIX + window.getId())
                .name("Maintenance: " + window.getName())
                .description("Suppresses alerts during maintenance window " + window.getId())
                .priority(config.getMaintenanceRulePriority())
                .maintenanceWindowId(window.getId())
                .conditions(SuppressionConditions.builder()
                        .sources(window.getServices())
                        .schedule(SuppressionSchedule.builder()
                                .maintenanceWindows(List.of(new TimeInterval(window.getStart(), window.getEnd())))
                                .build())
                        .build())
                .action(SuppressionAction.builder()
                        .type(SuppressionType.TEMPORARY)
                        .endTime(window.getEnd())
                        .notifyOnSuppression(true)
                        .build())
                .build();
    }

    private void publishMaintenance(SentinelEventType type, MaintenanceWindow window) {
        log.info("Maintenance window {} ({}) is now {}", window.getId(), window.getName(), window.getStatus());
        eventBus.publish(SentinelEvent.builder()
                .type(type)
                .timestamp(clock.instant())
                .subjectId(window.getId())
                .attribute("name", String.valueOf(window.getName()))
                .attribute("status", window.getStatus().name())
                .build());
    }

    private Optional<RegisteredRule> findRegistered(String ruleId) {
        return rules.stream().filter(r -> r.rule().getId().equals(ruleId)).findFirst();
    }

    private static Pattern compile(SuppressionConditions conditions) {
        if (conditions == null || conditions.getMessagePattern() == null || conditions.getMessagePattern().isBlank()) {
            return null;
        }
        return Pattern.compile(conditions.getMessagePattern(), Pattern.CASE_INSENSITIVE);
    }

    private record RegisteredRule(SuppressionRule rule, long sequence, Pattern messagePattern) {
        static final Comparator<RegisteredRule> EVALUATION_ORDER = Comparator
                .comparingInt((RegisteredRule r) -> r.rule().getPriority()).reversed()
                .thenComparingLong(RegisteredRule::sequence);
    }

    private record FrequencyCounter(Instant windowStart, Instant lastSeen, int count) {
        boolean expired(Instant at, FrequencyLimit limit) {
            return !at.isBefore(windowStart.plus(limit.getWindow()));
        }
    }
}
