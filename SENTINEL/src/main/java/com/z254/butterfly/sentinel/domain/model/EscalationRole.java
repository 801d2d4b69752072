package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A named group of contacts, optionally narrowed by an on-call schedule.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationRole {

    private String id;

    private String name;

    @Builder.Default
    private List<EscalationContact> contacts = new ArrayList<>();

    /** Absent schedule means all active contacts are always on call */
    private OnCallSchedule schedule;
}
