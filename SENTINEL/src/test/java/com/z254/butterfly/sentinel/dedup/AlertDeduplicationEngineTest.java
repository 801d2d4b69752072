package com.z254.butterfly.sentinel.dedup;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.domain.model.Alert;
import com.z254.butterfly.sentinel.domain.model.Severity;
import com.z254.butterfly.sentinel.event.SentinelEventBus;
import com.z254.butterfly.sentinel.event.SentinelEventType;
import com.z254.butterfly.sentinel.observability.SentinelMetrics;
import com.z254.butterfly.sentinel.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.z254.butterfly.sentinel.support.TestAlerts.T0;
import static com.z254.butterfly.sentinel.support.TestAlerts.alert;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AlertDeduplicationEngineTest {

    private SentinelProperties properties;
    private SentinelEventBus eventBus;
    private SimpleMeterRegistry meterRegistry;
    private MutableClock clock;
    private AlertClusterer clusterer;
    private ThreadPoolTaskExecutor clusteringExecutor;
    private AlertDeduplicationEngine engine;

    @BeforeEach
    void setUp() {
        properties = new SentinelProperties();
        eventBus = new SentinelEventBus();
        meterRegistry = new SimpleMeterRegistry();
        clock = new MutableClock(T0);
        clusterer = new FeatureHashClusterer();
        clusteringExecutor = newExecutor(2, 100);
        engine = newEngine();
    }

    @AfterEach
    void tearDown() {
        clusteringExecutor.shutdown();
    }

    private AlertDeduplicationEngine newEngine() {
        return new AlertDeduplicationEngine(properties, new AlertFingerprinter(properties), clusterer,
                eventBus, new SentinelMetrics(meterRegistry), clock, clusteringExecutor);
    }

    private static ThreadPoolTaskExecutor newExecutor(int threads, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("test-clustering-");
        executor.initialize();
        return executor;
    }

    @Nested
    @DisplayName("Grouping")
    class Grouping {

        @Test
        void firstAlertStartsNewGroup() {
            Alert alert = alert("api", Severity.HIGH, "Connection refused");

            DeduplicationResult result = engine.process(alert);

            assertThat(result.isNew()).isTrue();
            assertThat(result.isSuppressed()).isFalse();
            assertThat(result.getMatchType()).isEqualTo(DeduplicationResult.MatchType.NEW_GROUP);
            assertThat(alert.getGroupId()).isEqualTo(result.getGroupId());
            assertThat(alert.getFingerprint()).isNotBlank();
            assertThat(engine.activeGroupCount()).isEqualTo(1);
        }

        @Test
        void exactDuplicateJoinsGroupAndCounts() {
            DeduplicationResult first = engine.process(alert("api", Severity.HIGH, "Connection refused to 10.0.0.1"));
            Alert duplicate = alert("api", Severity.HIGH, "Connection refused to 10.0.0.2", T0.plusSeconds(30));

            DeduplicationResult second = engine.process(duplicate);

            assertThat(second.isNew()).isFalse();
            assertThat(second.getMatchType()).isEqualTo(DeduplicationResult.MatchType.EXACT);
            assertThat(second.getGroupId()).isEqualTo(first.getGroupId());
            assertThat(second.getSimilarAlerts()).hasSize(2);
            assertThat(duplicate.getCount()).isEqualTo(2);
            assertThat(engine.getGroup(first.getGroupId())).get()
                    .satisfies(group -> {
                        assertThat(group.getCount()).isEqualTo(2);
                        assertThat(group.getLastSeen()).isEqualTo(T0.plusSeconds(30));
                    });
        }

        @Test
        void alertAtWindowBoundaryStillJoins() {
            DeduplicationResult first = engine.process(alert("api", Severity.HIGH, "Connection refused"));

            DeduplicationResult second = engine.process(
                    alert("api", Severity.HIGH, "Connection refused", T0.plus(Duration.ofMinutes(5))));

            assertThat(second.getGroupId()).isEqualTo(first.getGroupId());
        }

        @Test
        void alertPastWindowReplacesExpiredGroup() {
            DeduplicationResult first = engine.process(alert("api", Severity.HIGH, "Connection refused"));

            DeduplicationResult second = engine.process(
                    alert("api", Severity.HIGH, "Connection refused", T0.plus(Duration.ofMinutes(5)).plusSeconds(1)));

            assertThat(second.isNew()).isTrue();
            assertThat(second.getGroupId()).isNotEqualTo(first.getGroupId());
            assertThat(engine.getGroup(first.getGroupId())).isEmpty();
            assertThat(engine.getStats().getExpiredGroups()).isEqualTo(1);
        }

        @Test
        void similarMessageJoinsBySimilarity() {
            properties.getDeduplication().setClusteringEnabled(false);
            DeduplicationResult first = engine.process(alert("payments", Severity.HIGH, "Payment gateway timeout"));

            DeduplicationResult second = engine.process(alert("payments", Severity.HIGH, "Payment gateway timeouts"));

            assertThat(second.getMatchType()).isEqualTo(DeduplicationResult.MatchType.SIMILARITY);
            assertThat(second.getGroupId()).isEqualTo(first.getGroupId());
        }

        @Test
        void sameClusterJoinsByClusterMatch() {
            DeduplicationResult first = engine.process(alert("payments", Severity.HIGH, "Payment gateway timeout"));

            // same length, source and severity land in the same feature-hash bucket
            DeduplicationResult second = engine.process(alert("payments", Severity.HIGH, "Payment gateway timeaut"));

            assertThat(second.getMatchType()).isEqualTo(DeduplicationResult.MatchType.CLUSTER);
            assertThat(second.getGroupId()).isEqualTo(first.getGroupId());
        }

        @Test
        void dissimilarAlertStartsOwnGroup() {
            engine.process(alert("payments", Severity.HIGH, "Payment gateway timeout"));

            DeduplicationResult other = engine.process(alert("search", Severity.LOW, "Index rebuild finished"));

            assertThat(other.isNew()).isTrue();
            assertThat(engine.getGroups()).hasSize(2);
        }

        @Test
        void higherSeverityMemberBecomesRepresentative() {
            properties.getDeduplication().setFingerprintFields(List.of("source", "message"));
            engine = newEngine();
            DeduplicationResult first = engine.process(alert("api", Severity.MEDIUM, "Connection refused"));
            Alert critical = alert("api", Severity.CRITICAL, "Connection refused");

            engine.process(critical);

            assertThat(engine.getGroup(first.getGroupId())).get()
                    .satisfies(group -> {
                        assertThat(group.getSeverity()).isEqualTo(Severity.CRITICAL);
                        assertThat(group.getRepresentative()).isSameAs(critical);
                    });
        }
    }

    @Nested
    @DisplayName("Suppression")
    class Suppression {

        @Test
        void groupOverCapacitySuppressesFurtherAlerts() {
            properties.getDeduplication().setMaxAlertsPerGroup(3);

            for (int i = 0; i < 3; i++) {
                assertThat(engine.process(alert("api", Severity.HIGH, "Connection refused")).isSuppressed()).isFalse();
            }
            DeduplicationResult fourth = engine.process(alert("api", Severity.HIGH, "Connection refused"));

            assertThat(fourth.isSuppressed()).isTrue();
            assertThat(engine.getStats().getSuppressedAlerts()).isEqualTo(1);
        }

        @Test
        void criticalAlertsAreNeverSuppressed() {
            properties.getDeduplication().setMaxAlertsPerGroup(1);

            engine.process(alert("db", Severity.CRITICAL, "Primary down"));
            DeduplicationResult second = engine.process(alert("db", Severity.CRITICAL, "Primary down"));
            DeduplicationResult third = engine.process(alert("db", Severity.CRITICAL, "Primary down"));

            assertThat(second.isSuppressed()).isFalse();
            assertThat(third.isSuppressed()).isFalse();
            assertThat(engine.suppressGroup(third.getGroupId(), Duration.ofMinutes(10))).isFalse();
        }

        @Test
        void operatorSuppressionExpires() {
            properties.getDeduplication().setTimeWindow(Duration.ofHours(1));
            DeduplicationResult first = engine.process(alert("api", Severity.HIGH, "Connection refused"));

            assertThat(engine.suppressGroup(first.getGroupId(), Duration.ofMinutes(10))).isTrue();
            assertThat(engine.process(alert("api", Severity.HIGH, "Connection refused", T0.plusSeconds(60)))
                    .isSuppressed()).isTrue();

            clock.advance(Duration.ofMinutes(11));
            assertThat(engine.process(alert("api", Severity.HIGH, "Connection refused", T0.plus(Duration.ofMinutes(11))))
                    .isSuppressed()).isFalse();
        }

        @Test
        void unsuppressClearsOperatorSuppression() {
            DeduplicationResult first = engine.process(alert("api", Severity.HIGH, "Connection refused"));
            engine.suppressGroup(first.getGroupId(), null);

            assertThat(engine.unsuppressGroup(first.getGroupId())).isTrue();
            assertThat(engine.process(alert("api", Severity.HIGH, "Connection refused")).isSuppressed()).isFalse();
        }
    }

    @Nested
    @DisplayName("Clustering fallback")
    class ClusteringFallback {

        @Test
        void slowClustererFallsBackToSimilarity() {
            properties.getDeduplication().setClusteringTimeout(Duration.ofMillis(20));
            clusterer = alert -> {
                try {
                    Thread.sleep(500);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "cluster_slow";
            };
            engine = newEngine();

            DeduplicationResult first = engine.process(alert("payments", Severity.HIGH, "Payment gateway timeout"));
            DeduplicationResult second = engine.process(alert("payments", Severity.HIGH, "Payment gateway timeouts"));

            assertThat(first.isNew()).isTrue();
            assertThat(second.getMatchType()).isEqualTo(DeduplicationResult.MatchType.SIMILARITY);
            assertThat(meterRegistry.counter("sentinel.dedup.clustering.fallbacks").count()).isEqualTo(2.0);
        }

        @Test
        void failingClustererFallsBackToSimilarity() {
            clusterer = alert -> {
                throw new IllegalStateException("model unavailable");
            };
            engine = newEngine();

            DeduplicationResult result = engine.process(alert("api", Severity.LOW, "Slow response"));

            assertThat(result.isNew()).isTrue();
            assertThat(meterRegistry.counter("sentinel.dedup.clustering.fallbacks").count()).isEqualTo(1.0);
        }

        @Test
        void timedOutClustererCallIsInterrupted() throws InterruptedException {
            properties.getDeduplication().setClusteringTimeout(Duration.ofMillis(20));
            CountDownLatch interrupted = new CountDownLatch(1);
            clusterer = alert -> {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    Thread.currentThread().interrupt();
                }
                return "cluster_hung";
            };
            engine = newEngine();

            DeduplicationResult result = engine.process(alert("api", Severity.HIGH, "Connection refused"));

            assertThat(result.isNew()).isTrue();
            assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        }

        @Test
        void saturatedClusteringPoolRejectsInsteadOfQueueing() {
            properties.getDeduplication().setClusteringTimeout(Duration.ofMillis(20));
            clusteringExecutor.shutdown();
            clusteringExecutor = newExecutor(1, 1);
            CountDownLatch release = new CountDownLatch(1);
            AtomicInteger calls = new AtomicInteger();
            clusterer = alert -> {
                calls.incrementAndGet();
                boolean released = false;
                while (!released) {
                    try {
                        released = release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        // keeps the worker busy so later calls have to queue
                    }
                }
                return "cluster_stuck";
            };
            engine = newEngine();

            try {
                for (int i = 0; i < 5; i++) {
                    assertThat(engine.process(alert("api-" + i, Severity.HIGH, "Disk full " + i)).isNew()).isTrue();
                }

                assertThat(clusteringExecutor.getThreadPoolExecutor().getQueue()).hasSizeLessThanOrEqualTo(1);
                assertThat(calls.get()).isEqualTo(1);
                assertThat(meterRegistry.counter("sentinel.dedup.clustering.fallbacks").count()).isEqualTo(5.0);
            } finally {
                release.countDown();
            }
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        void concurrentIdenticalAlertsCreateOneGroup() throws Exception {
            int threads = 16;
            ExecutorService callers = Executors.newFixedThreadPool(threads);
            try {
                for (int round = 0; round < 50; round++) {
                    AlertDeduplicationEngine roundEngine = newEngine();
                    CountDownLatch start = new CountDownLatch(1);
                    List<Future<DeduplicationResult>> futures = new ArrayList<>();
                    for (int i = 0; i < threads; i++) {
                        Alert alert = alert("api", Severity.HIGH, "Connection refused");
                        futures.add(callers.submit(() -> {
                            start.await();
                            return roundEngine.process(alert);
                        }));
                    }
                    start.countDown();

                    int created = 0;
                    for (Future<DeduplicationResult> future : futures) {
                        if (future.get(10, TimeUnit.SECONDS).isNew()) {
                            created++;
                        }
                    }

                    assertThat(created).as("new groups in round %d", round).isEqualTo(1);
                    assertThat(roundEngine.getGroups()).singleElement()
                            .satisfies(group -> assertThat(group.getCount()).isEqualTo(threads));
                }
            } finally {
                callers.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Maintenance")
    class Maintenance {

        @Test
        void evictsGroupsIdleForTwoWindows() {
            engine.process(alert("api", Severity.HIGH, "Connection refused"));
            clock.advance(Duration.ofMinutes(9));
            assertThat(engine.evictExpiredGroups()).isZero();

            clock.advance(Duration.ofMinutes(2));
            assertThat(engine.evictExpiredGroups()).isEqualTo(1);
            assertThat(engine.activeGroupCount()).isZero();
        }

        @Test
        void statsTrackDedupRate() {
            engine.process(alert("api", Severity.HIGH, "Connection refused"));
            engine.process(alert("api", Severity.HIGH, "Connection refused"));
            engine.process(alert("search", Severity.LOW, "Index rebuild finished"));

            DeduplicationStats stats = engine.getStats();

            assertThat(stats.getTotalAlerts()).isEqualTo(3);
            assertThat(stats.getUniqueAlerts()).isEqualTo(2);
            assertThat(stats.getDedupRate()).isCloseTo(1.0 / 3, within(1e-9));

            engine.resetStats();
            assertThat(engine.getStats().getTotalAlerts()).isZero();
        }

        @Test
        void publishesNewGroupEvent() {
            Alert alert = alert("api", Severity.HIGH, "Connection refused");

            StepVerifier.create(eventBus.subscribe(Set.of(SentinelEventType.NEW_GROUP)))
                    .then(() -> engine.process(alert))
                    .assertNext(event -> {
                        assertThat(event.getType()).isEqualTo(SentinelEventType.NEW_GROUP);
                        assertThat(event.getAlertId()).isEqualTo(alert.getId());
                    })
                    .thenCancel()
                    .verify(Duration.ofSeconds(5));
        }
    }
}
