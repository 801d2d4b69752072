package com.z254.butterfly.sentinel.domain.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * A single reported problem instance.
 * <p>
 * Supplied by an external reporter. The deduplication engine fills in the fingerprint,
 * group membership, occurrence count and suppression flag; the pipeline attaches the
 * business impact score to {@link #metadata}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    public static final String METADATA_SCORE = "businessImpactScore";
    public static final int MAX_MESSAGE_LENGTH = 10_000;

    @NotBlank(message = "id is required")
    private String id;

    @NotNull(message = "timestamp is required")
    private Instant timestamp;

    @NotNull(message = "severity is required")
    private Severity severity;

    /** Owning service or component */
    @NotBlank(message = "source is required")
    private String source;

    @NotBlank(message = "message is required")
    @Size(max = MAX_MESSAGE_LENGTH, message = "message exceeds {max} characters")
    private String message;

    /** Computed grouping key, never supplied by the reporter */
    private String fingerprint;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    @Builder.Default
    private Set<String> tags = new HashSet<>();

    private boolean suppressed;

    private String groupId;

    @Builder.Default
    private int count = 1;

    /** How long the underlying condition has lasted, if known */
    private Duration duration;

    public boolean hasTags() {
        return tags != null && !tags.isEmpty();
    }
}
