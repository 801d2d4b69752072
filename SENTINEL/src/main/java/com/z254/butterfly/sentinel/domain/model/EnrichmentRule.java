package com.z254.butterfly.sentinel.domain.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.validator.constraints.time.DurationMin;

import java.time.Duration;

/**
 * Binds matching alerts to an enrichment source and describes the lookup to run against it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EnrichmentRule {

    private String id;

    private String name;

    private String description;

    /** Id of the {@code EnrichmentSource} queried by this rule */
    @NotBlank(message = "sourceId is required")
    private String sourceId;

    @NotNull(message = "type is required")
    private EnrichmentType type;

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private EnrichmentConditions conditions = EnrichmentConditions.builder().build();

    /**
     * Query with {@code {{alert.source}}}, {@code {{alert.severity}}}, {@code {{alert.message}}},
     * {@code {{alert.timestamp}}} and {@code {{alert.tags}}} placeholders.
     */
    private String queryTemplate;

    /** How far back the lookup reaches; also the cache bucket width */
    @NotNull(message = "timeWindow is required")
    @DurationMin(millis = 1, message = "timeWindow must be positive")
    @Builder.Default
    private Duration timeWindow = Duration.ofMinutes(30);

    @Positive(message = "maxResults must be positive")
    @Builder.Default
    private int maxResults = 100;
}
