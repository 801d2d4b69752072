package com.z254.butterfly.sentinel.dedup;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.domain.model.Alert;
import com.z254.butterfly.sentinel.domain.model.AlertGroup;
import com.z254.butterfly.sentinel.domain.model.Severity;
import com.z254.butterfly.sentinel.event.SentinelEvent;
import com.z254.butterfly.sentinel.event.SentinelEventBus;
import com.z254.butterfly.sentinel.event.SentinelEventType;
import com.z254.butterfly.sentinel.observability.SentinelMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Groups incoming alerts and decides whether they are suppressed as duplicates.
 * <p>
 * Matching order for an incoming alert:
 * <ol>
 *     <li>exact fingerprint match inside the group's time window</li>
 *     <li>clusterer-assisted fuzzy match above the similarity threshold</li>
 *     <li>linear scan over live groups, best similarity above the threshold</li>
 *     <li>a new group</li>
 * </ol>
 * Group creation is atomic per fingerprint; appends to a group are serialized on the group.
 */
@Slf4j
@Component
public class AlertDeduplicationEngine {

    static final int SIMILAR_ALERTS_LIMIT = 10;

    private final SentinelProperties.Deduplication config;
    private final AlertFingerprinter fingerprinter;
    private final AlertClusterer clusterer;
    private final SentinelEventBus eventBus;
    private final SentinelMetrics metrics;
    private final Clock clock;
    private final AsyncTaskExecutor clusteringExecutor;

    private final Map<String, AlertGroup> groupsByFingerprint = new ConcurrentHashMap<>();
    private final Map<String, AlertGroup> groupsById = new ConcurrentHashMap<>();
    private final Map<String, String> clusterByGroupId = new ConcurrentHashMap<>();

    private final AtomicLong groupSequence = new AtomicLong();
    private final AtomicLong totalAlerts = new AtomicLong();
    private final AtomicLong uniqueAlerts = new AtomicLong();
    private final AtomicLong suppressedAlerts = new AtomicLong();
    private final AtomicLong expiredGroups = new AtomicLong();
    private final AtomicLong processingNanos = new AtomicLong();

    public AlertDeduplicationEngine(SentinelProperties properties,
                                    AlertFingerprinter fingerprinter,
                                    AlertClusterer clusterer,
                                    SentinelEventBus eventBus,
                                    SentinelMetrics metrics,
                                    Clock clock,
                                    @Qualifier("clusteringTaskExecutor") AsyncTaskExecutor clusteringExecutor) {
        this.config = properties.getDeduplication();
        this.fingerprinter = fingerprinter;
        this.clusterer = clusterer;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.clusteringExecutor = clusteringExecutor;
    }

    /**
     * Place the alert in a group and decide whether it is suppressed.
     * Mutates the alert's fingerprint, group id, count and suppressed flag.
     */
    public DeduplicationResult process(Alert alert) {
        long start = System.nanoTime();
        try {
            String fingerprint = fingerprinter.fingerprint(alert);
            alert.setFingerprint(fingerprint);
            totalAlerts.incrementAndGet();

            AlertGroup existing = groupsByFingerprint.get(fingerprint);
            if (existing != null && appendIfInWindow(existing, alert)) {
                return joined(existing, alert, DeduplicationResult.MatchType.EXACT);
            }

            Optional<String> clusterId = config.isClusteringEnabled() ? assignCluster(alert) : Optional.empty();
            if (clusterId.isPresent()) {
                Optional<AlertGroup> clustered = findSimilarityMatch(alert, groupsInCluster(clusterId.get()));
                if (clustered.isPresent()) {
                    return joined(clustered.get(), alert, DeduplicationResult.MatchType.CLUSTER);
                }
            }

            Optional<AlertGroup> similar = findSimilarityMatch(alert, new ArrayList<>(groupsById.values()));
            if (similar.isPresent()) {
                return joined(similar.get(), alert, DeduplicationResult.MatchType.SIMILARITY);
            }

            return createOrJoin(fingerprint, alert, clusterId);
        } finally {
            processingNanos.addAndGet(System.nanoTime() - start);
        }
    }

    /**
     * Operator suppression of a whole group. Critical groups are never suppressed.
     *
     * @return false if the group does not exist or is critical
     */
    public boolean suppressGroup(String groupId, Duration duration) {
        AlertGroup group = groupsById.get(groupId);
        if (group == null) {
            return false;
        }
        synchronized (group) {
            if (group.getSeverity() == Severity.CRITICAL) {
                log.info("Refusing to suppress critical group {}", groupId);
                return false;
            }
            group.setSuppressed(true);
            group.setSuppressedUntil(duration != null ? clock.instant().plus(duration) : null);
        }
        log.info("Suppressed group {} for {}", groupId, duration);
        return true;
    }

    public boolean unsuppressGroup(String groupId) {
        AlertGroup group = groupsById.get(groupId);
        if (group == null) {
            return false;
        }
        synchronized (group) {
            group.setSuppressed(false);
            group.setSuppressedUntil(null);
        }
        return true;
    }

    public Optional<AlertGroup> getGroup(String groupId) {
        return Optional.ofNullable(groupsById.get(groupId));
    }

    public List<AlertGroup> getGroups() {
        List<AlertGroup> groups = new ArrayList<>(groupsById.values());
        groups.sort(Comparator.comparingLong(AlertGroup::getSequence));
        return groups;
    }

    public int activeGroupCount() {
        return groupsById.size();
    }

    public DeduplicationStats getStats() {
        long total = totalAlerts.get();
        long unique = uniqueAlerts.get();
        return DeduplicationStats.builder()
                .totalAlerts(total)
                .uniqueAlerts(unique)
                .suppressedAlerts(suppressedAlerts.get())
                .expiredGroups(expiredGroups.get())
                .activeGroups(groupsById.size())
                .averageProcessingMillis(total > 0 ? processingNanos.get() / 1_000_000.0 / total : 0.0)
                .dedupRate(total > 0 ? (double) (total - unique) / total : 0.0)
                .build();
    }

    public void resetStats() {
        totalAlerts.set(0);
        uniqueAlerts.set(0);
        suppressedAlerts.set(0);
        expiredGroups.set(0);
        processingNanos.set(0);
    }

    /**
     * Evict groups whose last member is older than twice the time window.
     *
     * @return number of evicted groups
     */
    @Scheduled(fixedDelayString = "${sentinel.deduplication.sweep-interval:PT1M}")
    public int evictExpiredGroups() {
        Instant cutoff = clock.instant().minus(config.getTimeWindow().multipliedBy(2));
        int evicted = 0;
        for (AlertGroup group : new ArrayList<>(groupsByFingerprint.values())) {
            boolean stale;
            synchronized (group) {
                stale = group.getLastSeen().isBefore(cutoff);
            }
            if (stale && groupsByFingerprint.remove(group.getFingerprint(), group)) {
                forget(group);
                evicted++;
            }
        }
        if (evicted > 0) {
            metrics.recordGroupsExpired(evicted);
            log.debug("Evicted {} expired alert groups, {} remain", evicted, groupsById.size());
        }
        return evicted;
    }

    // ========== Private Methods ==========

    private DeduplicationResult createOrJoin(String fingerprint, Alert alert, Optional<String> clusterId) {
        AlertGroup[] replaced = new AlertGroup[1];
        boolean[] created = new boolean[1];
        AlertGroup group = groupsByFingerprint.compute(fingerprint, (key, existing) -> {
            if (existing != null && appendIfInWindow(existing, alert)) {
                return existing;
            }
            replaced[0] = existing;
            created[0] = true;
            return AlertGroup.startWith("group_" + UUID.randomUUID(), key, alert,
                    clock.instant(), groupSequence.incrementAndGet());
        });

        if (!created[0]) {
            return joined(group, alert, DeduplicationResult.MatchType.EXACT);
        }
        if (replaced[0] != null) {
            forget(replaced[0]);
        }
        groupsById.put(group.getId(), group);
        clusterId.ifPresent(cluster -> clusterByGroupId.put(group.getId(), cluster));
        uniqueAlerts.incrementAndGet();
        metrics.recordGroupCreated();

        alert.setGroupId(group.getId());
        alert.setCount(1);
        alert.setSuppressed(false);

        publish(SentinelEventType.NEW_GROUP, group, alert);
        log.debug("New alert group {} for source {}", group.getId(), alert.getSource());

        return DeduplicationResult.builder()
                .isNew(true)
                .groupId(group.getId())
                .suppressed(false)
                .similarAlerts(List.of(alert))
                .matchType(DeduplicationResult.MatchType.NEW_GROUP)
                .build();
    }

    private DeduplicationResult joined(AlertGroup group, Alert alert, DeduplicationResult.MatchType matchType) {
        boolean suppressed;
        List<Alert> similar;
        synchronized (group) {
            suppressed = isSuppressed(group);
            alert.setGroupId(group.getId());
            alert.setCount(group.getCount());
            alert.setSuppressed(suppressed);
            similar = group.firstMembers(SIMILAR_ALERTS_LIMIT);
        }
        metrics.recordDuplicate();
        publish(SentinelEventType.GROUP_UPDATED, group, alert);
        if (suppressed) {
            suppressedAlerts.incrementAndGet();
            metrics.recordGroupSuppression();
            publish(SentinelEventType.ALERT_SUPPRESSED, group, alert);
        }
        return DeduplicationResult.builder()
                .isNew(false)
                .groupId(group.getId())
                .suppressed(suppressed)
                .similarAlerts(similar)
                .matchType(matchType)
                .build();
    }

    /**
     * Called with the group lock held, after the alert was appended, so never for a first member.
     */
    private boolean isSuppressed(AlertGroup group) {
        if (group.getSeverity() == Severity.CRITICAL) {
            group.setSuppressed(false);
            return false;
        }
        if (group.getCount() <= 1) {
            return false;
        }
        if (group.getCount() > config.getMaxAlertsPerGroup()) {
            return true;
        }
        if (group.isSuppressed() && group.getSuppressedUntil() != null
                && clock.instant().isAfter(group.getSuppressedUntil())) {
            group.setSuppressed(false);
            group.setSuppressedUntil(null);
        }
        return group.isSuppressed();
    }

    private boolean appendIfInWindow(AlertGroup group, Alert alert) {
        synchronized (group) {
            if (!group.isWithinWindow(alert.getTimestamp(), config.getTimeWindow())) {
                return false;
            }
            group.append(alert);
            return true;
        }
    }

    private List<AlertGroup> groupsInCluster(String clusterId) {
        List<AlertGroup> candidates = new ArrayList<>();
        clusterByGroupId.forEach((groupId, cluster) -> {
            if (cluster.equals(clusterId)) {
                AlertGroup group = groupsById.get(groupId);
                if (group != null) {
                    candidates.add(group);
                }
            }
        });
        return candidates;
    }

    private Optional<String> assignCluster(Alert alert) {
        long timeoutMillis = config.getClusteringTimeout().toMillis();
        Future<String> future = null;
        try {
            future = clusteringExecutor.submit(() -> clusterer.clusterOf(alert));
            return Optional.ofNullable(future.get(timeoutMillis, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Clustering timed out after {}ms for alert {}, using similarity matching",
                    timeoutMillis, alert.getId());
        } catch (ExecutionException e) {
            log.warn("Clustering failed for alert {}, using similarity matching: {}",
                    alert.getId(), e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Clustering interrupted for alert {}", alert.getId());
        } catch (RuntimeException e) {
            log.warn("Clustering unavailable for alert {}: {}", alert.getId(), e.getMessage());
        }
        metrics.recordClusteringFallback();
        return Optional.empty();
    }

    /**
     * Best-scoring in-window group at or above the threshold; ties go to the newest group.
     * The alert is appended to the chosen group before returning.
     */
    private Optional<AlertGroup> findSimilarityMatch(Alert alert, List<AlertGroup> candidates) {
        AlertGroup best = null;
        double bestScore = -1.0;
        for (AlertGroup group : candidates) {
            Alert representative;
            synchronized (group) {
                if (!group.isWithinWindow(alert.getTimestamp(), config.getTimeWindow())) {
                    continue;
                }
                representative = group.getRepresentative();
            }
            double score = fingerprinter.similarity(alert, representative);
            if (score < config.getSimilarityThreshold()) {
                continue;
            }
            if (score > bestScore || (score == bestScore && group.getSequence() > best.getSequence())) {
                best = group;
                bestScore = score;
            }
        }
        if (best != null && appendIfInWindow(best, alert)) {
            return Optional.of(best);
        }
        return Optional.empty();
    }

    private void forget(AlertGroup group) {
        groupsById.remove(group.getId(), group);
        clusterByGroupId.remove(group.getId());
        expiredGroups.incrementAndGet();
        eventBus.publish(SentinelEvent.builder()
                .type(SentinelEventType.GROUP_EXPIRED)
                .timestamp(clock.instant())
                .subjectId(group.getId())
                .attribute("fingerprint", group.getFingerprint())
                .attribute("count", group.getCount())
                .build());
    }

    private void publish(SentinelEventType type, AlertGroup group, Alert alert) {
        eventBus.publish(SentinelEvent.builder()
                .type(type)
                .timestamp(clock.instant())
                .subjectId(group.getId())
                .alertId(alert.getId())
                .attribute("count", alert.getCount())
                .attribute("severity", group.getSeverity().name())
                .build());
    }
}
