package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuppressionAction {

    @Builder.Default
    private SuppressionType type = SuppressionType.PERMANENT;

    private Duration duration;

    private Instant endTime;

    private boolean notifyOnSuppression;

    public static SuppressionAction permanent() {
        return SuppressionAction.builder().build();
    }

    public static SuppressionAction temporary(Duration duration) {
        return SuppressionAction.builder().type(SuppressionType.TEMPORARY).duration(duration).build();
    }
}
