package com.z254.butterfly.sentinel.suppression;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.domain.model.Alert;
import com.z254.butterfly.sentinel.domain.model.DailyTimeRange;
import com.z254.butterfly.sentinel.domain.model.FrequencyLimit;
import com.z254.butterfly.sentinel.domain.model.MaintenanceWindow;
import com.z254.butterfly.sentinel.domain.model.MaintenanceWindowStatus;
import com.z254.butterfly.sentinel.domain.model.Severity;
import com.z254.butterfly.sentinel.domain.model.SuppressionAction;
import com.z254.butterfly.sentinel.domain.model.SuppressionConditions;
import com.z254.butterfly.sentinel.domain.model.SuppressionRule;
import com.z254.butterfly.sentinel.domain.model.SuppressionSchedule;
import com.z254.butterfly.sentinel.domain.model.SuppressionStatus;
import com.z254.butterfly.sentinel.event.SentinelEventBus;
import com.z254.butterfly.sentinel.event.SentinelEventType;
import com.z254.butterfly.sentinel.observability.SentinelMetrics;
import com.z254.butterfly.sentinel.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.z254.butterfly.sentinel.support.TestAlerts.T0;
import static com.z254.butterfly.sentinel.support.TestAlerts.alert;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlertSuppressionEngineTest {

    private SentinelEventBus eventBus;
    private MutableClock clock;
    private AlertSuppressionEngine engine;

    @BeforeEach
    void setUp() {
        eventBus = new SentinelEventBus();
        clock = new MutableClock(T0);
        engine = new AlertSuppressionEngine(new SentinelProperties(), eventBus,
                new SentinelMetrics(new SimpleMeterRegistry()), clock);
    }

    private static SuppressionRule rule(String id, int priority, SuppressionConditions conditions) {
        return SuppressionRule.builder()
                .id(id)
                .name(id)
                .priority(priority)
                .conditions(conditions)
                .action(SuppressionAction.permanent())
                .build();
    }

    @Nested
    @DisplayName("Rule matching")
    class Matching {

        @Test
        void noRulesMeansNotSuppressed() {
            assertThat(engine.evaluate(alert("api", Severity.LOW, "noise")).isSuppressed()).isFalse();
        }

        @Test
        void sourceAndSeverityConditionsMustBothHold() {
            engine.addRule(rule("api-low", 0, SuppressionConditions.builder()
                    .sources(Set.of("api"))
                    .severities(Set.of(Severity.LOW))
                    .build()));

            assertThat(engine.evaluate(alert("api", Severity.LOW, "noise")).isSuppressed()).isTrue();
            assertThat(engine.evaluate(alert("api", Severity.HIGH, "noise")).isSuppressed()).isFalse();
            assertThat(engine.evaluate(alert("db", Severity.LOW, "noise")).isSuppressed()).isFalse();
        }

        @Test
        void messagePatternIsCaseInsensitiveFind() {
            engine.addRule(rule("health", 0, SuppressionConditions.builder()
                    .messagePattern("health ?check")
                    .build()));

            assertThat(engine.evaluate(alert("lb", Severity.MEDIUM, "Upstream HealthCheck flapping")).isSuppressed()).isTrue();
            assertThat(engine.evaluate(alert("lb", Severity.MEDIUM, "Upstream latency high")).isSuppressed()).isFalse();
        }

        @Test
        void tagsAndMetadataConditions() {
            engine.addRule(rule("canary", 0, SuppressionConditions.builder()
                    .tags(Set.of("canary"))
                    .metadata(Map.of("env", "staging"))
                    .build()));
            Alert staging = alert("api", Severity.HIGH, "Errors");
            staging.setTags(Set.of("canary", "web"));
            staging.setMetadata(Map.of("env", "staging"));
            Alert production = alert("api", Severity.HIGH, "Errors");
            production.setTags(Set.of("canary"));
            production.setMetadata(Map.of("env", "production"));

            assertThat(engine.evaluate(staging).isSuppressed()).isTrue();
            assertThat(engine.evaluate(production).isSuppressed()).isFalse();
        }

        @Test
        void scheduleUsesAlertTimestampAndTimezone() {
            engine.addRule(rule("nightly-batch", 0, SuppressionConditions.builder()
                    .schedule(SuppressionSchedule.builder()
                            .days(Set.of(DayOfWeek.MONDAY))
                            .timeRanges(List.of(new DailyTimeRange(LocalTime.of(22, 0), LocalTime.of(2, 0))))
                            .build())
                    .build()));

            assertThat(engine.evaluate(alert("batch", Severity.LOW, "lag", T0.plus(Duration.ofHours(13)))).isSuppressed())
                    .as("Monday 23:00").isTrue();
            assertThat(engine.evaluate(alert("batch", Severity.LOW, "lag", T0)).isSuppressed())
                    .as("Monday 10:00").isFalse();
        }

        @Test
        void disabledRulesNeverMatch() {
            SuppressionRule disabled = rule("off", 0, SuppressionConditions.builder().build());
            disabled.setEnabled(false);
            engine.addRule(disabled);

            assertThat(engine.evaluate(alert("api", Severity.LOW, "noise")).isSuppressed()).isFalse();
        }

        @Test
        void ordinaryRuleSuppressesCriticalAlerts() {
            engine.addRule(rule("batch", 0, SuppressionConditions.builder().sources(Set.of("batch")).build()));

            SuppressionDecision decision = engine.evaluate(alert("batch", Severity.CRITICAL, "Export failed"));

            assertThat(decision.isSuppressed()).isTrue();
            assertThat(decision.getRuleId()).isEqualTo("batch");
        }
    }

    @Nested
    @DisplayName("Rule ordering")
    class Ordering {

        @Test
        void highestPriorityMatchingRuleWins() {
            engine.addRule(rule("broad", 1, SuppressionConditions.builder().build()));
            engine.addRule(rule("specific", 5, SuppressionConditions.builder().sources(Set.of("api")).build()));

            SuppressionDecision decision = engine.evaluate(alert("api", Severity.LOW, "noise"));

            assertThat(decision.getRuleId()).isEqualTo("specific");
            assertThat(engine.getRules()).extracting(SuppressionRule::getId).containsExactly("specific", "broad");
        }

        @Test
        void equalPriorityFallsBackToRegistrationOrder() {
            engine.addRule(rule("first", 1, SuppressionConditions.builder().build()));
            engine.addRule(rule("second", 1, SuppressionConditions.builder().build()));
            // replacing a rule keeps its registration position
            engine.addRule(rule("first", 1, SuppressionConditions.builder().build()));

            assertThat(engine.evaluate(alert("api", Severity.LOW, "noise")).getRuleId()).isEqualTo("first");
        }

        @Test
        void updateReplacesConditionsOfExistingRule() {
            SuppressionRule original = engine.addRule(rule("quiet", 1, SuppressionConditions.builder()
                    .sources(Set.of("api")).build()));

            engine.updateRule(rule("quiet", 1, SuppressionConditions.builder().sources(Set.of("db")).build()));

            assertThat(engine.evaluate(alert("api", Severity.LOW, "noise")).isSuppressed()).isFalse();
            assertThat(engine.evaluate(alert("db", Severity.LOW, "noise")).getRuleId()).isEqualTo("quiet");
            assertThat(engine.getRule("quiet").orElseThrow().getCreatedAt()).isEqualTo(original.getCreatedAt());
            assertThatThrownBy(() -> engine.updateRule(rule("missing", 1, SuppressionConditions.builder().build())))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void removedRuleNoLongerMatches() {
            engine.addRule(rule("broad", 1, SuppressionConditions.builder().build()));

            assertThat(engine.removeRule("broad")).isTrue();
            assertThat(engine.evaluate(alert("api", Severity.LOW, "noise")).isSuppressed()).isFalse();
            assertThat(engine.getRule("broad")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Frequency limits")
    class Frequency {

        @BeforeEach
        void addThrottle() {
            engine.addRule(rule("throttle", 0, SuppressionConditions.builder()
                    .frequency(new FrequencyLimit(2, Duration.ofMinutes(10)))
                    .build()));
        }

        @Test
        void suppressesOnlyBeyondLimitWithinWindow() {
            assertThat(engine.evaluate(alert("api", Severity.LOW, "noise", T0)).isSuppressed()).isFalse();
            assertThat(engine.evaluate(alert("api", Severity.LOW, "noise", T0.plusSeconds(60))).isSuppressed()).isFalse();
            assertThat(engine.evaluate(alert("api", Severity.LOW, "noise", T0.plusSeconds(120))).isSuppressed()).isTrue();

            assertThat(engine.evaluate(alert("api", Severity.LOW, "noise", T0.plus(Duration.ofMinutes(10)))).isSuppressed())
                    .as("new window").isFalse();
        }

        @Test
        void countersAreKeyedBySourceAndSeverity() {
            engine.evaluate(alert("api", Severity.LOW, "noise"));
            engine.evaluate(alert("api", Severity.LOW, "noise"));

            assertThat(engine.evaluate(alert("api", Severity.HIGH, "noise")).isSuppressed()).isFalse();
            assertThat(engine.evaluate(alert("db", Severity.LOW, "noise")).isSuppressed()).isFalse();
        }

        @Test
        void dryRunDoesNotAdvanceCounters() {
            engine.evaluate(alert("api", Severity.LOW, "noise"));
            engine.evaluate(alert("api", Severity.LOW, "noise"));

            assertThat(engine.testRule("throttle", alert("api", Severity.LOW, "noise"))).isTrue();
            assertThat(engine.testRule("throttle", alert("db", Severity.LOW, "noise"))).isFalse();
            assertThat(engine.getStats().getAlertsSuppressed()).isZero();
        }

        @Test
        void testRuleRejectsUnknownRule() {
            assertThatThrownBy(() -> engine.testRule("missing", alert("api", Severity.LOW, "noise")))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Suppression instances")
    class Instances {

        @Test
        void temporarySuppressionExpiresOnSweep() {
            SuppressionRule temporary = rule("temp", 0, SuppressionConditions.builder().build());
            temporary.setAction(SuppressionAction.temporary(Duration.ofMinutes(30)));
            engine.addRule(temporary);

            SuppressionDecision decision = engine.evaluate(alert("api", Severity.LOW, "noise"));

            assertThat(decision.getInstance().getExpiresAt()).isEqualTo(T0.plus(Duration.ofMinutes(30)));
            assertThat(engine.getActiveSuppressions()).hasSize(1);

            clock.advance(Duration.ofMinutes(30));
            engine.sweep();
            assertThat(engine.getActiveSuppressions()).isEmpty();
            assertThat(decision.getInstance().getStatus()).isEqualTo(SuppressionStatus.EXPIRED);
        }

        @Test
        void permanentSuppressionCanBeCancelled() {
            engine.addRule(rule("perm", 0, SuppressionConditions.builder().build()));
            SuppressionDecision decision = engine.evaluate(alert("api", Severity.LOW, "noise"));

            assertThat(decision.getInstance().getExpiresAt()).isNull();
            assertThat(engine.cancelSuppression(decision.getInstance().getId())).isTrue();
            assertThat(engine.cancelSuppression(decision.getInstance().getId())).isFalse();
            assertThat(engine.getActiveSuppressions()).isEmpty();
        }

        @Test
        void notifyingRulePublishesRuleSuppressed() {
            SuppressionRule notifying = rule("loud", 0, SuppressionConditions.builder().build());
            notifying.getAction().setNotifyOnSuppression(true);
            engine.addRule(notifying);
            Alert alert = alert("api", Severity.LOW, "noise");

            StepVerifier.create(eventBus.subscribe(Set.of(SentinelEventType.RULE_SUPPRESSED)))
                    .then(() -> engine.evaluate(alert))
                    .assertNext(event -> {
                        assertThat(event.getSubjectId()).isEqualTo("loud");
                        assertThat(event.getAlertId()).isEqualTo(alert.getId());
                    })
                    .thenCancel()
                    .verify(Duration.ofSeconds(5));
        }
    }

    @Nested
    @DisplayName("Maintenance windows")
    class Maintenance {

        @Test
        void suppressesCriticalAlertsFromAffectedServices() {
            engine.scheduleMaintenanceWindow(MaintenanceWindow.builder()
                    .id("db-upgrade")
                    .name("DB upgrade")
                    .start(T0.minus(Duration.ofMinutes(10)))
                    .end(T0.plus(Duration.ofHours(1)))
                    .services(Set.of("db"))
                    .build());

            SuppressionDecision decision = engine.evaluate(alert("db", Severity.CRITICAL, "Primary down"));

            assertThat(decision.isSuppressed()).isTrue();
            assertThat(decision.isMaintenance()).isTrue();
            assertThat(decision.getInstance().getExpiresAt()).isEqualTo(T0.plus(Duration.ofHours(1)));
            assertThat(engine.evaluate(alert("api", Severity.CRITICAL, "Down")).isSuppressed()).isFalse();
        }

        @Test
        void maintenanceRuleOutranksOperatorRules() {
            engine.addRule(rule("broad", 100, SuppressionConditions.builder().build()));
            engine.scheduleMaintenanceWindow(MaintenanceWindow.builder()
                    .id("db-upgrade")
                    .name("DB upgrade")
                    .start(T0)
                    .end(T0.plus(Duration.ofHours(1)))
                    .build());

            assertThat(engine.evaluate(alert("db", Severity.HIGH, "slow")).getRuleId())
                    .isEqualTo("maint_rule_db-upgrade");
        }

        @Test
        void windowLifecycleFollowsClock() {
            MaintenanceWindow window = engine.scheduleMaintenanceWindow(MaintenanceWindow.builder()
                    .id("later")
                    .name("Later")
                    .start(T0.plus(Duration.ofHours(1)))
                    .end(T0.plus(Duration.ofHours(2)))
                    .build());
            assertThat(window.getStatus()).isEqualTo(MaintenanceWindowStatus.SCHEDULED);

            StepVerifier.create(eventBus.subscribe(Set.of(
                            SentinelEventType.MAINTENANCE_STARTED, SentinelEventType.MAINTENANCE_ENDED)))
                    .then(() -> {
                        clock.advance(Duration.ofMinutes(90));
                        engine.sweep();
                    })
                    .assertNext(event -> assertThat(event.getType()).isEqualTo(SentinelEventType.MAINTENANCE_STARTED))
                    .then(() -> {
                        clock.advance(Duration.ofMinutes(30));
                        engine.sweep();
                    })
                    .assertNext(event -> assertThat(event.getType()).isEqualTo(SentinelEventType.MAINTENANCE_ENDED))
                    .thenCancel()
                    .verify(Duration.ofSeconds(5));

            assertThat(window.getStatus()).isEqualTo(MaintenanceWindowStatus.COMPLETED);
            assertThat(engine.getRule("maint_rule_later")).isEmpty();
        }

        @Test
        void cancelledWindowStopsSuppressing() {
            engine.scheduleMaintenanceWindow(MaintenanceWindow.builder()
                    .id("now")
                    .name("Now")
                    .start(T0)
                    .end(T0.plus(Duration.ofHours(1)))
                    .build());

            assertThat(engine.cancelMaintenanceWindow("now")).isTrue();
            assertThat(engine.evaluate(alert("db", Severity.HIGH, "slow")).isSuppressed()).isFalse();
            assertThat(engine.getMaintenanceWindows()).extracting(MaintenanceWindow::getStatus)
                    .containsExactly(MaintenanceWindowStatus.CANCELLED);
        }

        @Test
        void rejectsInvertedWindow() {
            assertThatThrownBy(() -> engine.scheduleMaintenanceWindow(MaintenanceWindow.builder()
                    .name("bad")
                    .start(T0)
                    .end(T0.minusSeconds(1))
                    .build()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
