package com.z254.butterfly.sentinel.escalation;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.domain.model.EscalationContact;
import com.z254.butterfly.sentinel.domain.model.EscalationPolicy;
import com.z254.butterfly.sentinel.domain.model.EscalationRecord;
import com.z254.butterfly.sentinel.domain.model.EscalationRole;
import com.z254.butterfly.sentinel.domain.model.EscalationState;
import com.z254.butterfly.sentinel.domain.model.EscalationStatus;
import com.z254.butterfly.sentinel.domain.model.EscalationStep;
import com.z254.butterfly.sentinel.domain.model.Severity;
import com.z254.butterfly.sentinel.event.SentinelEvent;
import com.z254.butterfly.sentinel.event.SentinelEventBus;
import com.z254.butterfly.sentinel.event.SentinelEventType;
import com.z254.butterfly.sentinel.exception.EscalationException;
import com.z254.butterfly.sentinel.observability.SentinelMetrics;
import com.z254.butterfly.sentinel.observability.SentinelStructuredLogger;
import com.z254.butterfly.sentinel.observability.SentinelStructuredLogger.EscalationLogEvent;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives per-alert escalation through the ordered steps of a policy.
 * <p>
 * Each step notifies its roles and arms a timer for the step's absolute deadline. The next
 * deadline is computed from the previous one, not from the time the timer actually fired, so
 * late timers do not accumulate drift. A timer only advances the escalation if, when it fires,
 * the escalation is still active and still on the step that armed it; acknowledgment therefore
 * halts advancement even if cancelling the timer loses the race.
 */
@Slf4j
@Component
public class EscalationManager {

    private final SentinelProperties.Escalation config;
    private final TaskScheduler taskScheduler;
    private final NotificationDispatcher dispatcher;
    private final OnCallScheduleResolver scheduleResolver;
    private final SentinelEventBus eventBus;
    private final SentinelMetrics metrics;
    private final SentinelStructuredLogger structuredLogger;
    private final Clock clock;

    private final Map<String, EscalationPolicy> policies = new ConcurrentHashMap<>();
    private final Map<String, EscalationRole> roles = new ConcurrentHashMap<>();
    private final Map<String, EscalationState> states = new ConcurrentHashMap<>();
    private final Map<String, String> escalationByAlert = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();

    private final AtomicLong notificationsSent = new AtomicLong();
    private final AtomicLong notificationsFailed = new AtomicLong();

    public EscalationManager(SentinelProperties properties,
                             @Qualifier("escalationTaskScheduler") TaskScheduler taskScheduler,
                             NotificationDispatcher dispatcher,
                             OnCallScheduleResolver scheduleResolver,
                             SentinelEventBus eventBus,
                             SentinelMetrics metrics,
                             SentinelStructuredLogger structuredLogger,
                             Clock clock) {
        this.config = properties.getEscalation();
        this.taskScheduler = taskScheduler;
        this.dispatcher = dispatcher;
        this.scheduleResolver = scheduleResolver;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    // ========== Registry ==========

    public void registerPolicy(EscalationPolicy policy) {
        if (policy.getId() == null || policy.getSteps().isEmpty()) {
            throw new EscalationException("Escalation policy needs an id and at least one step: " + policy);
        }
        policies.put(policy.getId(), policy);
        log.info("Registered escalation policy {} with {} steps", policy.getId(), policy.getSteps().size());
    }

    /**
     * Make a registered policy the one used when a request names none.
     */
    public void setDefaultPolicy(String policyId) {
        if (!policies.containsKey(policyId)) {
            throw new EscalationException("Unknown escalation policy: " + policyId);
        }
        config.setDefaultPolicyId(policyId);
        log.info("Default escalation policy set to {}", policyId);
    }

    public Optional<EscalationPolicy> getPolicy(String policyId) {
        return Optional.ofNullable(policies.get(policyId));
    }

    public void registerRole(EscalationRole role) {
        roles.put(role.getId(), role);
    }

    public Optional<EscalationRole> getRole(String roleId) {
        return Optional.ofNullable(roles.get(roleId));
    }

    // ========== Lifecycle ==========

    /**
     * Start escalating an alert and execute the first step.
     *
     * @return the escalation, or empty when the policy does not apply to the alert or no policy
     *         was named and no default policy is registered
     * @throws EscalationException when an explicitly named policy is unknown
     */
    public Optional<EscalationState> startEscalation(EscalationRequest request) {
        EscalationPolicy policy;
        if (request.getPolicyId() != null) {
            policy = policies.get(request.getPolicyId());
            if (policy == null) {
                throw new EscalationException("Unknown escalation policy: " + request.getPolicyId());
            }
        } else {
            policy = policies.get(config.getDefaultPolicyId());
            if (policy == null) {
                log.debug("No default escalation policy registered, alert {} not escalated", request.getAlertId());
                return Optional.empty();
            }
        }
        if (!policy.isEnabled()) {
            return Optional.empty();
        }
        EscalationStep first = policy.orderedSteps().get(0);
        if (first.getConditions() != null
                && !first.getConditions().matches(request.getSeverity(), request.getSource(), request.getTags())) {
            log.debug("Policy {} does not apply to alert {}", policy.getId(), request.getAlertId());
            return Optional.empty();
        }

        Instant now = clock.instant();
        EscalationState[] created = new EscalationState[1];
        String stateId = escalationByAlert.compute(request.getAlertId(), (alertId, existingId) -> {
            EscalationState existing = existingId != null ? states.get(existingId) : null;
            if (existing != null && existing.getStatus() == EscalationStatus.ACTIVE) {
                return existingId;
            }
            EscalationState state = EscalationState.builder()
                    .id("esc_" + UUID.randomUUID())
                    .alertId(alertId)
                    .policyId(policy.getId())
                    .severity(request.getSeverity())
                    .source(request.getSource())
                    .tags(new HashSet<>(request.getTags()))
                    .createdAt(now)
                    .build();
            states.put(state.getId(), state);
            created[0] = state;
            return state.getId();
        });
        if (created[0] == null) {
            return Optional.ofNullable(states.get(stateId));
        }

        EscalationState state = created[0];
        metrics.recordEscalationStarted();
        publish(SentinelEventType.ESCALATION_STARTED, state, Map.of("policyId", policy.getId()));
        structuredLogger.logEscalationEvent(state.getId(), state.getAlertId(), EscalationLogEvent.STARTED,
                "Escalation started", Map.of("policyId", policy.getId(), "severity", String.valueOf(state.getSeverity())));

        enterStep(state, policy, 0, now);
        return Optional.of(state);
    }

    /**
     * Acknowledge an escalation, halting further advancement.
     *
     * @return false if the escalation was no longer active
     */
    public boolean acknowledge(String escalationId, String acknowledgedBy) {
        EscalationState state = require(escalationId);
        Instant now = clock.instant();
        synchronized (state) {
            if (state.getStatus() != EscalationStatus.ACTIVE) {
                return false;
            }
            state.setStatus(EscalationStatus.ACKNOWLEDGED);
            state.setAcknowledgedBy(acknowledgedBy);
            state.setAcknowledgedStep(state.getCurrentStep());
            state.setAcknowledgedAt(now);
            state.setClosedAt(now);
        }
        cancelTimer(escalationId);
        metrics.recordEscalationAcknowledged(Duration.between(state.getCreatedAt(), now));
        publish(SentinelEventType.ESCALATION_ACKNOWLEDGED, state,
                Map.of("acknowledgedBy", String.valueOf(acknowledgedBy), "step", state.getAcknowledgedStep()));
        structuredLogger.logEscalationEvent(escalationId, state.getAlertId(), EscalationLogEvent.ACKNOWLEDGED,
                "Escalation acknowledged", Map.of("by", String.valueOf(acknowledgedBy), "step", state.getAcknowledgedStep()));
        return true;
    }

    public boolean acknowledgeAlert(String alertId, String acknowledgedBy) {
        return findByAlert(alertId)
                .filter(state -> state.getStatus() == EscalationStatus.ACTIVE)
                .map(state -> acknowledge(state.getId(), acknowledgedBy))
                .orElse(false);
    }

    /**
     * Mark the underlying problem resolved. Works on active and acknowledged escalations.
     */
    public boolean resolve(String escalationId, String resolvedBy) {
        EscalationState state = require(escalationId);
        Instant now = clock.instant();
        synchronized (state) {
            if (state.getStatus() != EscalationStatus.ACTIVE && state.getStatus() != EscalationStatus.ACKNOWLEDGED) {
                return false;
            }
            state.setStatus(EscalationStatus.RESOLVED);
            state.setResolvedAt(now);
            state.setClosedAt(now);
        }
        cancelTimer(escalationId);
        publish(SentinelEventType.ESCALATION_RESOLVED, state, Map.of("resolvedBy", String.valueOf(resolvedBy)));
        structuredLogger.logEscalationEvent(escalationId, state.getAlertId(), EscalationLogEvent.RESOLVED,
                "Escalation resolved", Map.of("by", String.valueOf(resolvedBy)));
        return true;
    }

    public boolean resolveAlert(String alertId, String resolvedBy) {
        return findByAlert(alertId)
                .map(state -> resolve(state.getId(), resolvedBy))
                .orElse(false);
    }

    public boolean cancel(String escalationId) {
        EscalationState state = require(escalationId);
        synchronized (state) {
            if (state.getStatus() != EscalationStatus.ACTIVE) {
                return false;
            }
            state.setStatus(EscalationStatus.CANCELLED);
            state.setClosedAt(clock.instant());
        }
        cancelTimer(escalationId);
        structuredLogger.logEscalationEvent(escalationId, state.getAlertId(), EscalationLogEvent.CANCELLED,
                "Escalation cancelled", null);
        return true;
    }

    // ========== Queries ==========

    public Optional<EscalationState> getEscalation(String escalationId) {
        return Optional.ofNullable(states.get(escalationId));
    }

    public Optional<EscalationState> findByAlert(String alertId) {
        String id = escalationByAlert.get(alertId);
        return id == null ? Optional.empty() : Optional.ofNullable(states.get(id));
    }

    public List<EscalationState> getActiveEscalations() {
        return states.values().stream()
                .filter(state -> state.getStatus() == EscalationStatus.ACTIVE)
                .toList();
    }

    public EscalationStats getStats() {
        List<EscalationState> snapshot = new ArrayList<>(states.values());
        Map<Integer, Long> byStep = new TreeMap<>();
        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        long ackCount = 0;
        long ackMillis = 0;
        long resolvedCount = 0;
        long resolveMillis = 0;
        for (EscalationState state : snapshot) {
            if (state.getSeverity() != null) {
                bySeverity.merge(state.getSeverity(), 1L, Long::sum);
            }
            if (state.getAcknowledgedAt() != null) {
                ackCount++;
                ackMillis += Duration.between(state.getCreatedAt(), state.getAcknowledgedAt()).toMillis();
                byStep.merge(state.getAcknowledgedStep(), 1L, Long::sum);
            }
            if (state.getResolvedAt() != null) {
                resolvedCount++;
                resolveMillis += Duration.between(state.getCreatedAt(), state.getResolvedAt()).toMillis();
            }
        }
        return EscalationStats.builder()
                .total(snapshot.size())
                .active(count(snapshot, EscalationStatus.ACTIVE))
                .acknowledged(count(snapshot, EscalationStatus.ACKNOWLEDGED))
                .resolved(count(snapshot, EscalationStatus.RESOLVED))
                .cancelled(count(snapshot, EscalationStatus.CANCELLED))
                .exhausted(count(snapshot, EscalationStatus.EXHAUSTED))
                .notificationsSent(notificationsSent.get())
                .notificationsFailed(notificationsFailed.get())
                .averageAcknowledgeMillis(ackCount > 0 ? (double) ackMillis / ackCount : 0.0)
                .averageResolutionMillis(resolvedCount > 0 ? (double) resolveMillis / resolvedCount : 0.0)
                .acknowledgedByStep(byStep)
                .bySeverity(bySeverity)
                .build();
    }

    /**
     * Auto-resolve stale active escalations and purge old terminal ones.
     */
    @Scheduled(fixedDelayString = "${sentinel.escalation.sweep-interval:PT5M}")
    public void sweep() {
        Instant now = clock.instant();
        Instant autoResolveCutoff = now.minus(config.getAutoResolveAfter());
        Instant retentionCutoff = now.minus(config.getRetention());
        for (EscalationState state : new ArrayList<>(states.values())) {
            if (state.getStatus() == EscalationStatus.ACTIVE && state.getCreatedAt().isBefore(autoResolveCutoff)) {
                log.info("Auto-resolving escalation {} for alert {} after {}",
                        state.getId(), state.getAlertId(), config.getAutoResolveAfter());
                resolve(state.getId(), "auto-resolve");
            } else if (state.getStatus().isTerminal() && state.getClosedAt() != null
                    && state.getClosedAt().isBefore(retentionCutoff)) {
                states.remove(state.getId());
                escalationByAlert.remove(state.getAlertId(), state.getId());
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        timers.values().forEach(timer -> timer.cancel(false));
        timers.clear();
        log.info("Escalation manager stopped, {} escalations still active", getActiveEscalations().size());
    }

    // ========== Private Methods ==========

    /**
     * Enter step {@code index}, anchored at the absolute instant the step starts.
     */
    private void enterStep(EscalationState state, EscalationPolicy policy, int index, Instant anchor) {
        List<EscalationStep> steps = policy.orderedSteps();
        int limit = Math.min(steps.size(), config.getMaxSteps());
        int stepIndex = index;
        Instant stepStart = anchor;

        synchronized (state) {
            while (true) {
                if (state.getStatus() != EscalationStatus.ACTIVE) {
                    return;
                }
                if (stepIndex >= limit) {
                    exhaust(state, policy);
                    return;
                }
                EscalationStep step = steps.get(stepIndex);
                if (stepIndex > 0 && step.getConditions() != null
                        && !step.getConditions().matches(state.getSeverity(), state.getSource(), state.getTags())) {
                    stepIndex++;
                    continue;
                }

                state.setCurrentStep(stepIndex);
                state.setStepEnteredAt(stepStart);
                state.getHistory().add(notifyRoles(state, policy, stepIndex, step.getRoleIds()));
                if (stepIndex > 0) {
                    publish(SentinelEventType.ESCALATION_ADVANCED, state, Map.of("step", stepIndex));
                }

                Instant deadline = stepStart.plus(step.getWaitTime());
                state.setNextDeadline(deadline);
                if (step.getWaitTime().isZero() || step.getWaitTime().isNegative()) {
                    stepIndex++;
                    continue;
                }
                arm(state.getId(), stepIndex, deadline);
                return;
            }
        }
    }

    private void arm(String escalationId, int step, Instant deadline) {
        ScheduledFuture<?> timer = taskScheduler.schedule(() -> onDeadline(escalationId, step), deadline);
        ScheduledFuture<?> previous = timer != null ? timers.put(escalationId, timer) : timers.remove(escalationId);
        if (previous != null) {
            previous.cancel(false);
        }
    }

    /**
     * Timer callback. Ignored unless the escalation is still active on the step that armed it.
     */
    void onDeadline(String escalationId, int armedStep) {
        EscalationState state = states.get(escalationId);
        if (state == null) {
            return;
        }
        Instant nextAnchor;
        synchronized (state) {
            if (state.getStatus() != EscalationStatus.ACTIVE || state.getCurrentStep() != armedStep) {
                log.debug("Ignoring stale timer for escalation {} step {} (status {}, step {})",
                        escalationId, armedStep, state.getStatus(), state.getCurrentStep());
                return;
            }
            nextAnchor = state.getNextDeadline();
        }
        EscalationPolicy policy = policies.get(state.getPolicyId());
        if (policy == null) {
            log.warn("Policy {} of escalation {} was removed, cancelling", state.getPolicyId(), escalationId);
            cancel(escalationId);
            return;
        }
        enterStep(state, policy, armedStep + 1, nextAnchor);
    }

    private void exhaust(EscalationState state, EscalationPolicy policy) {
        state.setStatus(EscalationStatus.EXHAUSTED);
        state.setClosedAt(clock.instant());
        timers.remove(state.getId());
        if (!policy.getFallbackRoleIds().isEmpty()) {
            state.getHistory().add(notifyRoles(state, policy, -1, policy.getFallbackRoleIds()));
        }
        metrics.recordEscalationExhausted();
        publish(SentinelEventType.ESCALATION_EXHAUSTED, state, Map.of("steps", policy.getSteps().size()));
        structuredLogger.logEscalationEvent(state.getId(), state.getAlertId(), EscalationLogEvent.EXHAUSTED,
                "Escalation exhausted without acknowledgment",
                Map.of("policyId", policy.getId(), "fallbackRoles", policy.getFallbackRoleIds().size()));
    }

    private EscalationRecord notifyRoles(EscalationState state, EscalationPolicy policy, int step, List<String> roleIds) {
        Instant now = clock.instant();
        List<String> notified = new ArrayList<>();
        int failures = 0;
        for (String roleId : roleIds) {
            EscalationRole role = roles.get(roleId);
            if (role == null) {
                log.warn("Escalation {} references unknown role {}", state.getId(), roleId);
                failures++;
                continue;
            }
            List<EscalationContact> targets = scheduleResolver.resolve(role, now);
            if (targets.isEmpty()) {
                log.warn("Role {} has no active on-call contacts for escalation {}", roleId, state.getId());
                continue;
            }
            EscalationNotification notification = EscalationNotification.builder()
                    .escalationId(state.getId())
                    .alertId(state.getAlertId())
                    .policyId(policy.getId())
                    .step(step)
                    .roleId(roleId)
                    .severity(state.getSeverity())
                    .source(state.getSource())
                    .subject(String.format("[%s] %s alert %s (step %d)",
                            state.getSeverity(), state.getSource(), state.getAlertId(), step + 1))
                    .createdAt(now)
                    .build();
            DeliveryReport report;
            try {
                report = dispatcher.deliver(notification, targets);
            } catch (RuntimeException e) {
                log.warn("Notification dispatch failed for escalation {} role {}: {}",
                        state.getId(), roleId, e.getMessage());
                report = DeliveryReport.allFailed(targets.stream().map(EscalationContact::getId).toList());
            }
            notified.addAll(report.getDeliveredContactIds());
            failures += report.getFailedContactIds().size();
            if (!report.getFailedContactIds().isEmpty()) {
                structuredLogger.logEscalationEvent(state.getId(), state.getAlertId(),
                        EscalationLogEvent.NOTIFICATION_FAILED, "Notification delivery failed",
                        Map.of("roleId", roleId, "failed", report.getFailedContactIds().size()));
            }
        }
        notificationsSent.addAndGet(notified.size());
        notificationsFailed.addAndGet(failures);
        metrics.recordNotifications(notified.size(), failures);
        structuredLogger.logEscalationEvent(state.getId(), state.getAlertId(), EscalationLogEvent.STEP_EXECUTED,
                "Escalation step executed", Map.of("step", step, "notified", notified.size(), "failures", failures));
        return EscalationRecord.builder()
                .step(step)
                .executedAt(now)
                .notifiedContactIds(notified)
                .failures(failures)
                .build();
    }

    private void cancelTimer(String escalationId) {
        ScheduledFuture<?> timer = timers.remove(escalationId);
        if (timer != null) {
            timer.cancel(false);
        }
    }

    private EscalationState require(String escalationId) {
        EscalationState state = states.get(escalationId);
        if (state == null) {
            throw new EscalationException("Unknown escalation: " + escalationId);
        }
        return state;
    }

    private static long count(List<EscalationState> states, EscalationStatus status) {
        return states.stream().filter(state -> state.getStatus() == status).count();
    }

    private void publish(SentinelEventType type, EscalationState state, Map<String, Object> attributes) {
        eventBus.publish(SentinelEvent.builder()
                .type(type)
                .timestamp(clock.instant())
                .subjectId(state.getId())
                .alertId(state.getAlertId())
                .attributes(attributes)
                .build());
    }
}
