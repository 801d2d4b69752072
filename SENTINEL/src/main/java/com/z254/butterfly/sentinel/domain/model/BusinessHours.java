package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Working hours calendar. Defaults to Monday-Friday, 09:00-17:00 UTC.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BusinessHours {

    private ZoneId timezone = ZoneId.of("UTC");

    private Set<DayOfWeek> days = EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);

    private LocalTime start = LocalTime.of(9, 0);

    private LocalTime end = LocalTime.of(17, 0);

    public boolean contains(Instant instant) {
        ZonedDateTime local = instant.atZone(timezone);
        if (!days.contains(local.getDayOfWeek())) {
            return false;
        }
        return new DailyTimeRange(start, end).contains(local.toLocalTime());
    }
}
