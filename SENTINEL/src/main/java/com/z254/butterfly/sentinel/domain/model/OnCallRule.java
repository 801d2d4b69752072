package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * One on-call slot: days of week plus a time range in the schedule's timezone.
 * An end before the start means the range crosses midnight.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OnCallRule {

    @Builder.Default
    private Set<DayOfWeek> days = EnumSet.allOf(DayOfWeek.class);

    @Builder.Default
    private LocalTime start = LocalTime.MIN;

    @Builder.Default
    private LocalTime end = LocalTime.MAX;

    /** Contacts on call during the slot; empty means every contact of the role */
    @Builder.Default
    private List<String> contactIds = new ArrayList<>();
}
