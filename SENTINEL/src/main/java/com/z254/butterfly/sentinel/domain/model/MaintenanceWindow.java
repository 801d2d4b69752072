package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Planned maintenance during which alerts from the listed services are suppressed,
 * critical ones included.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaintenanceWindow {

    private String id;

    private String name;

    private Instant start;

    private Instant end;

    /** Affected sources; empty means every source */
    @Builder.Default
    private Set<String> services = new HashSet<>();

    @Builder.Default
    private MaintenanceWindowStatus status = MaintenanceWindowStatus.SCHEDULED;

    private String createdBy;
}
