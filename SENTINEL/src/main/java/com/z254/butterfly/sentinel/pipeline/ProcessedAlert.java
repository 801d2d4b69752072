package com.z254.butterfly.sentinel.pipeline;

import com.z254.butterfly.sentinel.domain.model.Alert;
import com.z254.butterfly.sentinel.domain.model.BusinessImpactScore;
import com.z254.butterfly.sentinel.enrichment.EnrichmentResult;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one pass through {@link AlertProcessingPipeline}.
 */
@Value
@Builder
public class ProcessedAlert {

    /** The alert as enriched by deduplication and scoring */
    Alert alert;

    boolean isNew;

    String groupId;

    boolean suppressed;

    /** Why the alert was suppressed, null when it was not */
    String suppressionReason;

    List<Alert> similarAlerts;

    /** Null when scoring was skipped or failed */
    BusinessImpactScore score;

    /** Null when enrichment was disabled, failed or the alert was suppressed */
    EnrichmentResult enrichment;

    /** Null when no escalation was started */
    String escalationId;

    Duration processingTime;

    /** Elapsed time per pipeline step, in execution order */
    @Singular
    Map<PipelineStep, Duration> stepTimings;

    /** Failures of non-essential steps; the pipeline continued past each */
    @Singular
    List<String> errors;

    boolean budgetExceeded;

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
