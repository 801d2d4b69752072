package com.z254.butterfly.sentinel.health;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.pipeline.AlertProcessingPipeline;
import com.z254.butterfly.sentinel.pipeline.PipelineHealth;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SentinelHealthIndicatorTest {

    @Mock
    private AlertProcessingPipeline pipeline;

    private SentinelHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        indicator = new SentinelHealthIndicator(pipeline, new SentinelProperties());
    }

    private static PipelineHealth health(PipelineHealth.Status status, double errorRate) {
        return PipelineHealth.builder()
                .status(status)
                .errorRate(errorRate)
                .averageProcessingMillis(1.5)
                .activeGroups(4)
                .activeEscalations(1)
                .retainedEvents(120)
                .activePatterns(2)
                .build();
    }

    @Test
    void degradedPipelineIsStillUp() {
        when(pipeline.getHealth()).thenReturn(health(PipelineHealth.Status.DEGRADED, 20.0));

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("pipeline.status", "DEGRADED")
                            .containsEntry("activeGroups", 4)
                            .containsEntry("escalationEnabled", true)
                            .containsEntry("maxProcessingTime", "PT0.5S");
                })
                .verifyComplete();
    }

    @Test
    void unhealthyPipelineIsDown() {
        when(pipeline.getHealth()).thenReturn(health(PipelineHealth.Status.UNHEALTHY, 75.0));

        StepVerifier.create(indicator.health())
                .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.DOWN))
                .verifyComplete();
    }

    @Test
    void failingHealthReadIsDown() {
        when(pipeline.getHealth()).thenThrow(new IllegalStateException("not started"));

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails().get("error").toString()).contains("not started");
                })
                .verifyComplete();
    }
}
