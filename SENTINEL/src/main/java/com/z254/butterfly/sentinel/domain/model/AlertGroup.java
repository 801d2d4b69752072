package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Unit of deduplication: alerts sharing a fingerprint, or similar enough, within a time window.
 * <p>
 * Mutations go through {@link #append(Alert)} so that {@code count}, {@code lastSeen} and
 * {@code severity} stay consistent with the member list. Callers serialize access on the
 * group instance.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertGroup {

    private String id;

    private String fingerprint;

    /** Members in arrival order */
    @Builder.Default
    private List<Alert> alerts = new ArrayList<>();

    private Instant firstSeen;

    private Instant lastSeen;

    private int count;

    /** Highest severity seen, never downgraded */
    private Severity severity;

    private Alert representative;

    private boolean suppressed;

    private Instant suppressedUntil;

    private Instant createdAt;

    /** Creation order, breaks ties between groups created at the same instant */
    private long sequence;

    /**
     * Start a group from its first member.
     */
    public static AlertGroup startWith(String id, String fingerprint, Alert first, Instant createdAt, long sequence) {
        AlertGroup group = AlertGroup.builder()
                .id(id)
                .fingerprint(fingerprint)
                .firstSeen(first.getTimestamp())
                .lastSeen(first.getTimestamp())
                .severity(first.getSeverity())
                .representative(first)
                .createdAt(createdAt)
                .sequence(sequence)
                .build();
        group.alerts.add(first);
        group.count = 1;
        return group;
    }

    /**
     * Add a member. Severity and representative only change on a strictly higher severity.
     */
    public void append(Alert alert) {
        alerts.add(alert);
        count = alerts.size();
        if (lastSeen == null || alert.getTimestamp().isAfter(lastSeen)) {
            lastSeen = alert.getTimestamp();
        }
        if (alert.getSeverity().isHigherThan(severity)) {
            severity = alert.getSeverity();
            representative = alert;
        }
    }

    public boolean isWithinWindow(Instant timestamp, Duration window) {
        return !timestamp.isAfter(firstSeen.plus(window));
    }

    public List<Alert> firstMembers(int limit) {
        return new ArrayList<>(alerts.subList(0, Math.min(limit, alerts.size())));
    }
}
