package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Allow {@code maxAlerts} per {@code window}; alerts beyond that are suppressed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FrequencyLimit {

    private int maxAlerts;

    private Duration window;
}
