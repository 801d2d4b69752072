package com.z254.butterfly.sentinel.scoring;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.domain.model.Alert;
import com.z254.butterfly.sentinel.domain.model.BusinessContext;
import com.z254.butterfly.sentinel.domain.model.BusinessImpactScore;
import com.z254.butterfly.sentinel.domain.model.ScoringRule;
import com.z254.butterfly.sentinel.domain.model.ScoringWeights;
import com.z254.butterfly.sentinel.domain.model.ServiceTier;
import com.z254.butterfly.sentinel.domain.model.Severity;
import com.z254.butterfly.sentinel.domain.repository.InMemoryBusinessContextRepository;
import com.z254.butterfly.sentinel.event.SentinelEventBus;
import com.z254.butterfly.sentinel.event.SentinelEventType;
import com.z254.butterfly.sentinel.exception.ScoringConfigurationException;
import com.z254.butterfly.sentinel.observability.SentinelMetrics;
import com.z254.butterfly.sentinel.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static com.z254.butterfly.sentinel.support.TestAlerts.T0;
import static com.z254.butterfly.sentinel.support.TestAlerts.alert;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BusinessImpactScorerTest {

    private SentinelProperties properties;
    private InMemoryBusinessContextRepository contextRepository;
    private SentinelEventBus eventBus;
    private MutableClock clock;
    private BusinessImpactScorer scorer;

    @BeforeEach
    void setUp() {
        properties = new SentinelProperties();
        contextRepository = new InMemoryBusinessContextRepository();
        eventBus = new SentinelEventBus();
        clock = new MutableClock(T0);
        scorer = new BusinessImpactScorer(properties, contextRepository, eventBus,
                new SentinelMetrics(new SimpleMeterRegistry()), clock);
    }

    private static BusinessContext checkoutContext() {
        return BusinessContext.builder()
                .serviceId("checkout")
                .serviceName("Checkout")
                .tier(ServiceTier.CRITICAL)
                .sla(BusinessContext.Sla.builder().availability(99.99).responseTimeMillis(50).errorRate(0.05).build())
                .users(BusinessContext.UserBase.builder().total(1000).affected(500).vip(0).build())
                .revenue(BusinessContext.Revenue.builder().hourly(10_000).build())
                .build();
    }

    @Nested
    @DisplayName("Unregistered services")
    class UnregisteredServices {

        @Test
        void usesConservativeDefaults() {
            BusinessImpactScore score = scorer.score(alert("unknown", Severity.HIGH, "Slow response"));

            // 75*.25 + 50*.20 + 25*.20 + 10*.15 + 20*.10 + 30*.10
            assertThat(score.getScore()).isCloseTo(40.25, within(1e-9));
            assertThat(score.getBreakdown().getServiceImportance()).isEqualTo(50.0);
            assertThat(score.getBreakdown().getUserImpact()).isEqualTo(25.0);
            assertThat(score.getBreakdown().getRevenueImpact()).isEqualTo(10.0);
            assertThat(score.getBreakdown().getFrequency()).isEqualTo(20.0);
            assertThat(score.getBreakdown().getDuration()).isEqualTo(30.0);
            assertThat(score.getConfidence()).isCloseTo(1.0 / 6, within(1e-9));
        }

        @Test
        void frequencyUsesHistoryBeforeCurrentAlert() {
            BusinessImpactScore first = scorer.score(alert("api", Severity.LOW, "Slow response"));
            BusinessImpactScore second = scorer.score(alert("api", Severity.LOW, "Slow response", T0.plusSeconds(60)));

            assertThat(first.getBreakdown().getFrequency()).isEqualTo(20.0);
            assertThat(second.getBreakdown().getFrequency()).isEqualTo(25.0);
            assertThat(second.getConfidence()).isCloseTo(2.0 / 6, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Registered services")
    class RegisteredServices {

        @Test
        void criticalServiceDuringBusinessHoursIsHighImpact() {
            contextRepository.save(checkoutContext());
            Alert alert = alert("checkout", Severity.CRITICAL, "Payments failing");
            alert.setDuration(Duration.ofHours(5));

            StepVerifier.create(eventBus.subscribe(Set.of(SentinelEventType.HIGH_IMPACT_ALERT)))
                    .then(() -> {
                        BusinessImpactScore score = scorer.score(alert);
                        // 100*.25 + 100*.20 + 75*.20 + 100*.15 + 20*.10 + 100*.10
                        assertThat(score.getScore()).isCloseTo(87.0, within(1e-9));
                        assertThat(score.getBreakdown().getUserImpact()).isCloseTo(75.0, within(1e-9));
                        assertThat(score.getConfidence()).isCloseTo(5.0 / 6, within(1e-9));
                        assertThat(score.getFactors()).contains("tier=CRITICAL", "businessHours");
                    })
                    .assertNext(event -> assertThat(event.getAlertId()).isEqualTo(alert.getId()))
                    .thenCancel()
                    .verify(Duration.ofSeconds(5));
        }

        @Test
        void revenueModelsShapeRevenueSignal() {
            BusinessContext context = checkoutContext();
            context.setRevenue(BusinessContext.Revenue.builder().hourly(1_000).build());
            Alert alert = alert("checkout", Severity.HIGH, "Slow checkout");

            // outside business hours: 1 000 per hour at risk
            properties.getScoring().setRevenueModel(SentinelProperties.RevenueModel.LINEAR);
            assertThat(scorer.revenueSignal(alert, context, false)).isCloseTo(10.0, within(1e-9));

            properties.getScoring().setRevenueModel(SentinelProperties.RevenueModel.EXPONENTIAL);
            assertThat(scorer.revenueSignal(alert, context, false)).isCloseTo(20.0, within(1e-9));

            properties.getScoring().setRevenueModel(SentinelProperties.RevenueModel.LOGARITHMIC);
            assertThat(scorer.revenueSignal(alert, context, false)).isCloseTo(Math.log10(1_001) * 25, within(1e-9));
        }

        @Test
        void serviceMultiplierScalesRevenueAtRisk() {
            properties.getScoring().setRevenueMultipliers(Map.of("checkout", 3.0, "default", 1.0));
            Alert alert = alert("checkout", Severity.HIGH, "Slow checkout");
            alert.setDuration(Duration.ofMinutes(30));

            assertThat(scorer.revenueAtRisk(alert, checkoutContext(), true)).isCloseTo(30_000.0, within(1e-6));
        }
    }

    @Nested
    @DisplayName("Scoring rules")
    class Rules {

        @Test
        void multiplierAndAdditiveApplyInPriorityOrder() {
            scorer.addRule(ScoringRule.builder().id("double").priority(10).multiplier(2.0).build());
            scorer.addRule(ScoringRule.builder().id("minus").priority(5).additive(-10).build());

            BusinessImpactScore score = scorer.score(alert("api", Severity.HIGH, "Slow response"));

            assertThat(score.getScore()).isCloseTo(40.25 * 2 - 10, within(1e-9));
            assertThat(scorer.getRules()).extracting(ScoringRule::getId).containsExactly("double", "minus");
        }

        @Test
        void scoreIsClampedIntoRange() {
            scorer.addRule(ScoringRule.builder().id("crush").additive(-500).build());
            assertThat(scorer.score(alert("api", Severity.LOW, "noise")).getScore()).isEqualTo(1.0);

            scorer.removeRule("crush");
            scorer.addRule(ScoringRule.builder().id("boost").multiplier(10).build());
            assertThat(scorer.score(alert("api", Severity.LOW, "noise")).getScore()).isEqualTo(100.0);
        }

        @Test
        void severityOverrideReplacesSeveritySignal() {
            scorer.addRule(ScoringRule.builder()
                    .id("api-high")
                    .sources(Set.of("api"))
                    .severityOverrides(Map.of(Severity.HIGH, 100.0))
                    .build());

            BusinessImpactScore api = scorer.score(alert("api", Severity.HIGH, "Slow response"));
            BusinessImpactScore db = scorer.score(alert("db", Severity.HIGH, "Slow response"));

            assertThat(api.getBreakdown().getSeverity()).isEqualTo(100.0);
            assertThat(db.getBreakdown().getSeverity()).isEqualTo(75.0);
        }

        @Test
        void businessHoursRuleOnlyMatchesInsideHours() {
            scorer.addRule(ScoringRule.builder().id("night").businessHours(false).additive(50).build());

            assertThat(scorer.score(alert("api", Severity.HIGH, "Slow response")).getFactors())
                    .doesNotContain("rule=night");

            clock.set(T0.plus(Duration.ofHours(12)));
            assertThat(scorer.score(alert("api", Severity.HIGH, "Slow response")).getFactors())
                    .contains("rule=night");
        }
    }

    @Nested
    @DisplayName("Weights")
    class Weights {

        @Test
        void rejectsWeightsNotSummingToOne() {
            ScoringWeights bad = ScoringWeights.builder().severity(0.5).build();

            assertThatThrownBy(() -> scorer.updateWeights(bad))
                    .isInstanceOf(ScoringConfigurationException.class)
                    .hasMessageContaining("sum to 1.0");
            assertThat(scorer.getWeights()).isEqualTo(ScoringWeights.defaults());
        }

        @Test
        void rejectsNegativeWeights() {
            ScoringWeights negative = ScoringWeights.builder().severity(-0.1).serviceImportance(0.55).build();

            assertThatThrownBy(negative::validate).isInstanceOf(ScoringConfigurationException.class);
        }

        @Test
        void constructionFailsFastOnInvalidConfiguredWeights() {
            properties.getScoring().setWeights(ScoringWeights.builder().frequency(0.5).build());

            assertThatThrownBy(() -> new BusinessImpactScorer(properties, contextRepository, eventBus,
                    new SentinelMetrics(new SimpleMeterRegistry()), clock))
                    .isInstanceOf(ScoringConfigurationException.class);
        }

        @Test
        void updatedWeightsApplyToNextScore() {
            scorer.updateWeights(ScoringWeights.builder()
                    .severity(1.0).serviceImportance(0).userImpact(0).revenueImpact(0).frequency(0).duration(0)
                    .build());

            assertThat(scorer.score(alert("api", Severity.MEDIUM, "Slow response")).getScore()).isEqualTo(50.0);
        }
    }

    @Nested
    @DisplayName("Queries and maintenance")
    class Queries {

        @Test
        void topAlertsAndStats() {
            Alert low = alert("api", Severity.LOW, "noise");
            Alert critical = alert("db", Severity.CRITICAL, "Primary down");
            scorer.score(low);
            scorer.score(critical);

            assertThat(scorer.getTopAlerts(1)).extracting(BusinessImpactScore::getAlertId)
                    .containsExactly(critical.getId());
            assertThat(scorer.getScore(low.getId())).isPresent();

            ScoringStats stats = scorer.getStats();
            assertThat(stats.getAlertsScored()).isEqualTo(2);
            assertThat(stats.getLowImpact()).isEqualTo(2);
            assertThat(stats.getDistribution()).containsEntry("21-40", 1L).containsEntry("41-60", 1L);
        }

        @Test
        void prunesIdleFrequencyHistory() {
            scorer.score(alert("api", Severity.LOW, "noise"));

            clock.advance(Duration.ofHours(25));
            assertThat(scorer.pruneHistory()).isEqualTo(1);

            BusinessImpactScore afterPrune = scorer.score(alert("api", Severity.LOW, "noise", clock.instant()));
            assertThat(afterPrune.getBreakdown().getFrequency()).isEqualTo(20.0);
        }
    }
}
