package com.z254.butterfly.sentinel.health;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.pipeline.AlertProcessingPipeline;
import com.z254.butterfly.sentinel.pipeline.PipelineHealth;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health indicator for the alert processing core.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Pipeline error rate and latency</li>
 *     <li>Live alert groups and active escalations</li>
 *     <li>Retained analytics events and active patterns</li>
 * </ul>
 * DOWN when more than half of processed alerts hit a step error.
 */
@Slf4j
@Component
public class SentinelHealthIndicator implements ReactiveHealthIndicator {

    private final AlertProcessingPipeline pipeline;
    private final SentinelProperties properties;

    public SentinelHealthIndicator(AlertProcessingPipeline pipeline, SentinelProperties properties) {
        this.pipeline = pipeline;
        this.properties = properties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    private Health checkHealth() {
        Map<String, Object> details = new HashMap<>();
        PipelineHealth health;
        try {
            health = pipeline.getHealth();
        } catch (Exception e) {
            log.error("Health check failed for alert pipeline", e);
            return Health.down()
                    .withDetail("error", "Failed to read pipeline health: " + e.getMessage())
                    .build();
        }

        details.put("pipeline.status", health.getStatus().name());
        details.put("pipeline.errorRate", health.getErrorRate());
        details.put("pipeline.averageProcessingMillis", health.getAverageProcessingMillis());
        details.put("activeGroups", health.getActiveGroups());
        details.put("activeEscalations", health.getActiveEscalations());
        details.put("retainedEvents", health.getRetainedEvents());
        details.put("activePatterns", health.getActivePatterns());

        // Configuration info
        details.put("maxProcessingTime", properties.getPipeline().getMaxProcessingTime().toString());
        details.put("deduplicationWindow", properties.getDeduplication().getTimeWindow().toString());
        details.put("escalationEnabled", properties.getEscalation().isEnabled());

        if (health.getStatus() == PipelineHealth.Status.UNHEALTHY) {
            return Health.down()
                    .withDetails(details)
                    .build();
        }
        return Health.up()
                .withDetails(details)
                .build();
    }
}
