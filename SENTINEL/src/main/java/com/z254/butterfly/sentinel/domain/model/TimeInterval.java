package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Absolute interval {@code [start, end)}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeInterval {

    private Instant start;

    private Instant end;

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }
}
