package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalTime;

/**
 * Time-of-day range, start inclusive and end exclusive. An end before the start wraps midnight.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyTimeRange {

    private LocalTime start;

    private LocalTime end;

    public boolean contains(LocalTime time) {
        if (!end.isBefore(start)) {
            return !time.isBefore(start) && time.isBefore(end);
        }
        return !time.isBefore(start) || time.isBefore(end);
    }
}
