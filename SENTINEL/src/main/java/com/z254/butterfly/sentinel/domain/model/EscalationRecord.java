package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * History entry: one executed step and who was notified.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationRecord {

    private int step;

    private Instant executedAt;

    @Builder.Default
    private List<String> notifiedContactIds = new ArrayList<>();

    private int failures;
}
