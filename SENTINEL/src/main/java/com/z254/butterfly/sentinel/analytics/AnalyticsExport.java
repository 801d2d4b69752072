package com.z254.butterfly.sentinel.analytics;

import com.z254.butterfly.sentinel.domain.model.AlertEvent;
import com.z254.butterfly.sentinel.domain.model.AlertPattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Diagnostic dump of the analytics state, as written by the JSON export.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsExport {

    private Instant exportedAt;

    @Builder.Default
    private List<AlertEvent> events = new ArrayList<>();

    @Builder.Default
    private List<AlertPattern> patterns = new ArrayList<>();

    private AlertMetricsSnapshot metrics;
}
