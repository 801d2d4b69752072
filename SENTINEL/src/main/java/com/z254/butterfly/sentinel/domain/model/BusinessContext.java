package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Business facts about a service, used to weight its alerts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusinessContext {

    /** Matches {@link Alert#getSource()} */
    private String serviceId;

    private String serviceName;

    @Builder.Default
    private ServiceTier tier = ServiceTier.MEDIUM;

    private Sla sla;

    private UserBase users;

    private Revenue revenue;

    @Builder.Default
    private List<String> dependencies = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Sla {
        /** Availability target in percent, e.g. 99.95 */
        private double availability;
        private double responseTimeMillis;
        /** Error rate target in percent */
        private double errorRate;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UserBase {
        private long total;
        private long affected;
        private long vip;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Revenue {
        private double hourly;
        private double daily;
        private double monthly;
    }
}
