package com.z254.butterfly.sentinel.escalation;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.domain.model.ContactType;
import com.z254.butterfly.sentinel.domain.model.EscalationContact;
import com.z254.butterfly.sentinel.domain.model.EscalationPolicy;
import com.z254.butterfly.sentinel.domain.model.EscalationRecord;
import com.z254.butterfly.sentinel.domain.model.EscalationRole;
import com.z254.butterfly.sentinel.domain.model.EscalationState;
import com.z254.butterfly.sentinel.domain.model.EscalationStatus;
import com.z254.butterfly.sentinel.domain.model.EscalationStep;
import com.z254.butterfly.sentinel.domain.model.Severity;
import com.z254.butterfly.sentinel.domain.model.StepConditions;
import com.z254.butterfly.sentinel.event.SentinelEventBus;
import com.z254.butterfly.sentinel.event.SentinelEventType;
import com.z254.butterfly.sentinel.exception.EscalationException;
import com.z254.butterfly.sentinel.observability.SentinelMetrics;
import com.z254.butterfly.sentinel.observability.SentinelStructuredLogger;
import com.z254.butterfly.sentinel.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;

import static com.z254.butterfly.sentinel.support.TestAlerts.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class EscalationManagerTest {

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> timer;

    private final List<Runnable> armedTimers = new ArrayList<>();
    private final List<Instant> armedDeadlines = new ArrayList<>();
    private final List<EscalationNotification> notifications = new ArrayList<>();

    private SentinelProperties properties;
    private SentinelEventBus eventBus;
    private MutableClock clock;
    private NotificationDispatcher dispatcher;
    private EscalationManager manager;

    @BeforeEach
    void setUp() {
        lenient().doAnswer(invocation -> {
            armedTimers.add(invocation.getArgument(0));
            armedDeadlines.add(invocation.getArgument(1));
            return timer;
        }).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));

        properties = new SentinelProperties();
        eventBus = new SentinelEventBus();
        clock = new MutableClock(T0);
        dispatcher = (notification, targets) -> {
            notifications.add(notification);
            return new DeliveryReport(targets.stream().map(EscalationContact::getId).toList(), List.of());
        };
        manager = newManager();

        manager.registerRole(role("primary", "alice"));
        manager.registerRole(role("secondary", "bob"));
        manager.registerRole(role("manager", "carol"));
        manager.registerPolicy(EscalationPolicy.builder()
                .id("default")
                .name("Default")
                .steps(List.of(
                        step(0, "primary", Duration.ofMinutes(5)),
                        step(1, "secondary", Duration.ofMinutes(10))))
                .fallbackRoleIds(List.of("manager"))
                .build());
    }

    private EscalationManager newManager() {
        return new EscalationManager(properties, taskScheduler, (notification, targets) ->
                dispatcher.deliver(notification, targets), new OnCallScheduleResolver(), eventBus,
                new SentinelMetrics(new SimpleMeterRegistry()), new SentinelStructuredLogger(), clock);
    }

    private static EscalationRole role(String id, String contactId) {
        return EscalationRole.builder()
                .id(id)
                .name(id)
                .contacts(List.of(EscalationContact.builder()
                        .id(contactId)
                        .name(contactId)
                        .type(ContactType.EMAIL)
                        .address(contactId + "@example.com")
                        .build()))
                .build();
    }

    private static EscalationStep step(int order, String roleId, Duration wait) {
        return EscalationStep.builder().order(order).roleIds(List.of(roleId)).waitTime(wait).build();
    }

    private static EscalationRequest request(String alertId, Severity severity) {
        return EscalationRequest.builder().alertId(alertId).severity(severity).source("checkout").build();
    }

    private EscalationState start(String alertId) {
        return manager.startEscalation(request(alertId, Severity.CRITICAL)).orElseThrow();
    }

    private void fireLatestTimer() {
        armedTimers.get(armedTimers.size() - 1).run();
    }

    @Nested
    @DisplayName("Starting")
    class Starting {

        @Test
        void startExecutesFirstStepAndArmsDeadline() {
            EscalationState state = start("alert-1");

            assertThat(state.getStatus()).isEqualTo(EscalationStatus.ACTIVE);
            assertThat(state.getCurrentStep()).isZero();
            assertThat(state.getHistory()).extracting(EscalationRecord::getNotifiedContactIds)
                    .containsExactly(List.of("alice"));
            assertThat(armedDeadlines).containsExactly(T0.plus(Duration.ofMinutes(5)));
            assertThat(notifications).extracting(EscalationNotification::getRoleId).containsExactly("primary");
        }

        @Test
        void secondStartForActiveAlertReturnsExistingEscalation() {
            EscalationState first = start("alert-1");

            EscalationState second = start("alert-1");

            assertThat(second.getId()).isEqualTo(first.getId());
            assertThat(notifications).hasSize(1);
        }

        @Test
        void unknownExplicitPolicyIsAnError() {
            EscalationRequest request = EscalationRequest.builder()
                    .alertId("alert-1").severity(Severity.HIGH).source("api").policyId("missing").build();

            assertThatThrownBy(() -> manager.startEscalation(request)).isInstanceOf(EscalationException.class);
        }

        @Test
        void missingDefaultPolicyMeansNoEscalation() {
            properties.getEscalation().setDefaultPolicyId("none-registered");

            assertThat(manager.startEscalation(request("alert-1", Severity.CRITICAL))).isEmpty();
        }

        @Test
        void defaultPolicyCanBeSwitched() {
            manager.registerPolicy(EscalationPolicy.builder()
                    .id("night")
                    .steps(List.of(step(0, "manager", Duration.ofMinutes(30))))
                    .build());

            manager.setDefaultPolicy("night");
            EscalationState state = start("alert-1");

            assertThat(state.getPolicyId()).isEqualTo("night");
            assertThat(notifications).extracting(EscalationNotification::getRoleId).containsExactly("manager");
            assertThatThrownBy(() -> manager.setDefaultPolicy("missing")).isInstanceOf(EscalationException.class);
        }

        @Test
        void firstStepConditionsGateTheEscalation() {
            manager.registerPolicy(EscalationPolicy.builder()
                    .id("critical-only")
                    .steps(List.of(EscalationStep.builder()
                            .order(0)
                            .roleIds(List.of("primary"))
                            .conditions(StepConditions.builder().severities(Set.of(Severity.CRITICAL)).build())
                            .build()))
                    .build());
            EscalationRequest low = EscalationRequest.builder()
                    .alertId("alert-1").severity(Severity.LOW).source("api").policyId("critical-only").build();

            assertThat(manager.startEscalation(low)).isEmpty();
        }

        @Test
        void policyWithoutStepsIsRejected() {
            assertThatThrownBy(() -> manager.registerPolicy(EscalationPolicy.builder().id("empty").build()))
                    .isInstanceOf(EscalationException.class);
        }
    }

    @Nested
    @DisplayName("Advancing")
    class Advancing {

        @Test
        void deadlineAdvancesToNextStep() {
            EscalationState state = start("alert-1");

            StepVerifier.create(eventBus.subscribe(Set.of(SentinelEventType.ESCALATION_ADVANCED)))
                    .then(() -> {
                        clock.advance(Duration.ofMinutes(5));
                        fireLatestTimer();
                    })
                    .assertNext(event -> assertThat(event.getAttributes()).containsEntry("step", 1))
                    .thenCancel()
                    .verify(Duration.ofSeconds(5));

            assertThat(state.getCurrentStep()).isEqualTo(1);
            assertThat(notifications).extracting(EscalationNotification::getRoleId)
                    .containsExactly("primary", "secondary");
        }

        @Test
        void lateTimerKeepsDeadlinesAnchoredToSchedule() {
            start("alert-1");

            clock.advance(Duration.ofMinutes(7));
            fireLatestTimer();

            assertThat(armedDeadlines).containsExactly(
                    T0.plus(Duration.ofMinutes(5)),
                    T0.plus(Duration.ofMinutes(15)));
        }

        @Test
        void unacknowledgedEscalationExhaustsAndNotifiesFallback() {
            EscalationState state = start("alert-1");

            fireLatestTimer();
            fireLatestTimer();

            assertThat(state.getStatus()).isEqualTo(EscalationStatus.EXHAUSTED);
            assertThat(notifications).extracting(EscalationNotification::getRoleId)
                    .containsExactly("primary", "secondary", "manager");
            assertThat(notifications.get(2).getStep()).isEqualTo(-1);
            assertThat(manager.getStats().getExhausted()).isEqualTo(1);
        }

        @Test
        void zeroWaitStepsRunBackToBack() {
            manager.registerPolicy(EscalationPolicy.builder()
                    .id("blast")
                    .steps(List.of(
                            step(0, "primary", Duration.ZERO),
                            step(1, "secondary", Duration.ZERO)))
                    .build());

            EscalationState state = manager.startEscalation(EscalationRequest.builder()
                    .alertId("alert-1").severity(Severity.HIGH).source("api").policyId("blast").build()).orElseThrow();

            assertThat(state.getStatus()).isEqualTo(EscalationStatus.EXHAUSTED);
            assertThat(state.getHistory()).hasSize(2);
            verify(taskScheduler, never()).schedule(any(Runnable.class), any(Instant.class));
        }

        @Test
        void stepsWhoseConditionsFailAreSkipped() {
            manager.registerPolicy(EscalationPolicy.builder()
                    .id("tiered")
                    .steps(List.of(
                            step(0, "primary", Duration.ofMinutes(5)),
                            EscalationStep.builder()
                                    .order(1)
                                    .roleIds(List.of("secondary"))
                                    .waitTime(Duration.ofMinutes(5))
                                    .conditions(StepConditions.builder().sources(Set.of("payments")).build())
                                    .build(),
                            step(2, "manager", Duration.ofMinutes(5))))
                    .build());
            EscalationState state = manager.startEscalation(EscalationRequest.builder()
                    .alertId("alert-1").severity(Severity.HIGH).source("api").policyId("tiered").build()).orElseThrow();

            fireLatestTimer();

            assertThat(state.getCurrentStep()).isEqualTo(2);
            assertThat(notifications).extracting(EscalationNotification::getRoleId)
                    .containsExactly("primary", "manager");
        }

        @Test
        void maxStepsCapsThePolicy() {
            properties.getEscalation().setMaxSteps(1);
            EscalationState state = start("alert-1");

            fireLatestTimer();

            assertThat(state.getStatus()).isEqualTo(EscalationStatus.EXHAUSTED);
            assertThat(notifications).extracting(EscalationNotification::getRoleId)
                    .containsExactly("primary", "manager");
        }

        @Test
        void dispatcherFailureIsRecordedAndEscalationContinues() {
            dispatcher = (notification, targets) -> {
                throw new IllegalStateException("smtp down");
            };

            EscalationState state = start("alert-1");

            assertThat(state.getHistory().get(0).getFailures()).isEqualTo(1);
            assertThat(state.getStatus()).isEqualTo(EscalationStatus.ACTIVE);
            assertThat(manager.getStats().getNotificationsFailed()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Acknowledging and resolving")
    class Closing {

        @Test
        void acknowledgmentHaltsAdvancementEvenIfTimerFires() {
            EscalationState state = start("alert-1");
            clock.advance(Duration.ofMinutes(2));

            assertThat(manager.acknowledge(state.getId(), "alice")).isTrue();
            fireLatestTimer();

            assertThat(state.getStatus()).isEqualTo(EscalationStatus.ACKNOWLEDGED);
            assertThat(state.getAcknowledgedStep()).isZero();
            assertThat(state.getAcknowledgedBy()).isEqualTo("alice");
            assertThat(notifications).hasSize(1);
            verify(timer).cancel(false);
            assertThat(manager.getStats().getAverageAcknowledgeMillis()).isEqualTo(120_000.0);
        }

        @Test
        void acknowledgeIsIdempotentForClosedEscalations() {
            EscalationState state = start("alert-1");
            manager.acknowledge(state.getId(), "alice");

            assertThat(manager.acknowledge(state.getId(), "bob")).isFalse();
            assertThat(state.getAcknowledgedBy()).isEqualTo("alice");
        }

        @Test
        void resolveWorksFromAcknowledged() {
            EscalationState state = start("alert-1");
            manager.acknowledgeAlert("alert-1", "alice");

            assertThat(manager.resolveAlert("alert-1", "alice")).isTrue();
            assertThat(state.getStatus()).isEqualTo(EscalationStatus.RESOLVED);
            assertThat(manager.getActiveEscalations()).isEmpty();
        }

        @Test
        void unknownEscalationIdIsAnError() {
            assertThatThrownBy(() -> manager.acknowledge("esc_missing", "alice"))
                    .isInstanceOf(EscalationException.class);
            assertThat(manager.acknowledgeAlert("no-such-alert", "alice")).isFalse();
        }

        @Test
        void cancelStopsActiveEscalation() {
            EscalationState state = start("alert-1");

            assertThat(manager.cancel(state.getId())).isTrue();
            fireLatestTimer();

            assertThat(state.getStatus()).isEqualTo(EscalationStatus.CANCELLED);
            assertThat(notifications).hasSize(1);
        }

        @Test
        void newEscalationMayStartAfterPreviousClosed() {
            EscalationState first = start("alert-1");
            manager.resolve(first.getId(), "alice");

            EscalationState second = start("alert-1");

            assertThat(second.getId()).isNotEqualTo(first.getId());
            assertThat(manager.findByAlert("alert-1")).contains(second);
        }
    }

    @Nested
    @DisplayName("Sweeping")
    class Sweeping {

        @Test
        void staleActiveEscalationsAreAutoResolvedThenPurged() {
            EscalationState state = start("alert-1");

            clock.advance(Duration.ofHours(25));
            manager.sweep();
            assertThat(state.getStatus()).isEqualTo(EscalationStatus.RESOLVED);
            assertThat(manager.getEscalation(state.getId())).isPresent();

            clock.advance(Duration.ofHours(25));
            manager.sweep();
            assertThat(manager.getEscalation(state.getId())).isEmpty();
            assertThat(manager.findByAlert("alert-1")).isEmpty();
        }
    }
}
