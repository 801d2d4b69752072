package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OnCallSchedule {

    @Builder.Default
    private ZoneId timezone = ZoneId.of("UTC");

    @Builder.Default
    private List<OnCallRule> rules = new ArrayList<>();
}
