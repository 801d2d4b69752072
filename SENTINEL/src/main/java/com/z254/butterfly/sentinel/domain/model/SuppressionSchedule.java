package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Time-based part of a suppression condition. Every populated part must hold.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuppressionSchedule {

    @Builder.Default
    private ZoneId timezone = ZoneId.of("UTC");

    @Builder.Default
    private Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);

    @Builder.Default
    private List<DailyTimeRange> timeRanges = new ArrayList<>();

    /** Match only inside (true) or outside (false) business hours */
    private Boolean businessHours;

    @Builder.Default
    private List<TimeInterval> maintenanceWindows = new ArrayList<>();
}
