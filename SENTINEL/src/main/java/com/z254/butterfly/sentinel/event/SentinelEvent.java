package com.z254.butterfly.sentinel.event;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class SentinelEvent {

    SentinelEventType type;

    Instant timestamp;

    /** Id of the subject: group, alert, pattern, escalation or window id depending on type */
    String subjectId;

    String alertId;

    @Singular("attribute")
    Map<String, Object> attributes;
}
