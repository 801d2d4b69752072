package com.z254.butterfly.sentinel.analytics;

import com.z254.butterfly.sentinel.domain.model.AlertEvent;
import com.z254.butterfly.sentinel.domain.model.AlertEventType;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Statistics shared by queries, metrics snapshots and pattern impact summaries.
 */
final class AlertStatistics {

    private AlertStatistics() {
    }

    /**
     * Nearest-rank percentile: sort ascending, take index {@code ceil(p/100 * n) - 1}, clamped.
     *
     * @return 0 for an empty input
     */
    static double percentile(Collection<Double> values, double p) {
        if (values.isEmpty()) {
            return 0.0;
        }
        List<Double> sorted = new ArrayList<>(values);
        sorted.sort(Double::compare);
        int index = (int) Math.ceil(p / 100.0 * sorted.size()) - 1;
        index = Math.max(0, Math.min(sorted.size() - 1, index));
        return sorted.get(index);
    }

    /**
     * Mean milliseconds from the earliest {@code CREATED} to the first {@code RESOLVED} event per
     * alert. Alerts missing either endpoint are left out.
     */
    static OptionalDouble meanTimeToResolve(Collection<AlertEvent> events) {
        return meanTimeTo(events, AlertEventType.RESOLVED);
    }

    static OptionalDouble meanTimeToAcknowledge(Collection<AlertEvent> events) {
        return meanTimeTo(events, AlertEventType.ACKNOWLEDGED);
    }

    static double average(Collection<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    /**
     * {@code part / whole * 100}, 0 when whole is 0.
     */
    static double percent(long part, long whole) {
        return whole > 0 ? (double) part / whole * 100.0 : 0.0;
    }

    static long countOfType(Collection<AlertEvent> events, AlertEventType type) {
        return events.stream().filter(event -> event.getType() == type).count();
    }

    static List<Double> scores(Collection<AlertEvent> events) {
        return events.stream()
                .filter(AlertEvent::hasScore)
                .map(AlertEvent::getBusinessImpactScore)
                .toList();
    }

    // ========== Private Methods ==========

    private static OptionalDouble meanTimeTo(Collection<AlertEvent> events, AlertEventType endType) {
        Map<String, Instant> created = new HashMap<>();
        Map<String, Instant> ended = new HashMap<>();
        for (AlertEvent event : events) {
            if (event.getType() == AlertEventType.CREATED) {
                created.merge(event.getAlertId(), event.getTimestamp(), AlertStatistics::earliest);
            } else if (event.getType() == endType) {
                ended.merge(event.getAlertId(), event.getTimestamp(), AlertStatistics::earliest);
            }
        }
        return created.entrySet().stream()
                .filter(entry -> ended.containsKey(entry.getKey()))
                .mapToLong(entry -> Duration.between(entry.getValue(), ended.get(entry.getKey())).toMillis())
                .filter(millis -> millis >= 0)
                .average();
    }

    private static Instant earliest(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }
}
