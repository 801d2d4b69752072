package com.z254.butterfly.sentinel.analytics;

import com.z254.butterfly.sentinel.domain.model.AlertEvent;
import com.z254.butterfly.sentinel.domain.model.AlertEventType;
import com.z254.butterfly.sentinel.domain.model.AlertPattern;
import com.z254.butterfly.sentinel.domain.model.PatternCriteria;
import com.z254.butterfly.sentinel.domain.model.PatternImpact;
import com.z254.butterfly.sentinel.domain.model.PatternType;
import com.z254.butterfly.sentinel.domain.model.Severity;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Four independent detectors evaluated for each newly recorded event.
 * <p>
 * Each detector looks at the history relevant to the new event (its source, its alert id, or
 * the trailing half hour) and yields at most one pattern under a deterministic id.
 */
public class PatternDetector {

    static final Duration CASCADE_WINDOW = Duration.ofMinutes(30);
    static final int CASCADE_MIN_EVENTS = 5;
    static final int CASCADE_MIN_SOURCES = 3;
    static final double PEAK_FACTOR = 1.5;
    static final double SEVERITY_ESCALATION_CONFIDENCE = 0.85;
    static final int SEVERITY_ESCALATION_MIN_EVENTS = 3;

    private final int minOccurrences;

    public PatternDetector(int minOccurrences) {
        this.minOccurrences = minOccurrences;
    }

    /**
     * @param newEvent the event just recorded, already part of {@code history}
     * @param history  events inside the analysis window, in arrival order
     * @param now      current time, anchors the cascading-failure window
     */
    public List<AlertPattern> detect(AlertEvent newEvent, List<AlertEvent> history, Instant now) {
        List<AlertPattern> detected = new ArrayList<>();
        highFrequency(newEvent, history).ifPresent(detected::add);
        cascadingFailure(newEvent, history, now).ifPresent(detected::add);
        timeOfDay(newEvent, history).ifPresent(detected::add);
        severityEscalation(newEvent, history).ifPresent(detected::add);
        return detected;
    }

    Optional<AlertPattern> highFrequency(AlertEvent newEvent, List<AlertEvent> history) {
        String source = newEvent.getSource();
        List<AlertEvent> created = createdFrom(source, history);
        if (created.size() < minOccurrences) {
            return Optional.empty();
        }
        List<AlertEvent> sourceEvents = history.stream()
                .filter(event -> source.equals(event.getSource()))
                .toList();
        return Optional.of(AlertPattern.builder()
                .id("high_freq_" + source)
                .name("High Frequency Alerts: " + source)
                .description("Frequent alerts from " + source)
                .type(PatternType.HIGH_FREQUENCY)
                .criteria(PatternCriteria.builder()
                        .sources(Set.of(source))
                        .frequencyThreshold(minOccurrences)
                        .build())
                .confidence(Math.min(0.95, created.size() / 50.0))
                .occurrences(created.size())
                .lastSeen(latest(created))
                .impact(impactOf(sourceEvents, created.size()))
                .recommendations(List.of(
                        "Review monitoring configuration for this source",
                        "Consider alert throttling or suppression rules",
                        "Investigate underlying system issues"))
                .build());
    }

    Optional<AlertPattern> cascadingFailure(AlertEvent newEvent, List<AlertEvent> history, Instant now) {
        Instant cutoff = now.minus(CASCADE_WINDOW);
        List<AlertEvent> recent = history.stream()
                .filter(event -> event.getType() == AlertEventType.CREATED)
                .filter(event -> !event.getTimestamp().isBefore(cutoff))
                .toList();
        if (recent.size() < CASCADE_MIN_EVENTS) {
            return Optional.empty();
        }
        Set<String> sources = recent.stream()
                .map(AlertEvent::getSource)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (sources.size() < CASCADE_MIN_SOURCES) {
            return Optional.empty();
        }
        return Optional.of(AlertPattern.builder()
                .id("cascading_failure")
                .name("Cascading Failure Pattern")
                .description("Multiple services failing within " + CASCADE_WINDOW.toMinutes() + " minutes")
                .type(PatternType.CASCADING_FAILURE)
                .criteria(PatternCriteria.builder()
                        .sources(sources)
                        .correlatedAlertIds(recent.stream().map(AlertEvent::getAlertId).distinct().toList())
                        .build())
                .confidence(Math.min(0.9, sources.size() / 10.0))
                .occurrences(recent.size())
                .lastSeen(latest(recent))
                .impact(PatternImpact.builder()
                        .averageBusinessImpact(AlertStatistics.average(AlertStatistics.scores(recent)))
                        .build())
                .recommendations(List.of(
                        "Check infrastructure dependencies",
                        "Review recent deployments",
                        "Investigate common failure points"))
                .build());
    }

    Optional<AlertPattern> timeOfDay(AlertEvent newEvent, List<AlertEvent> history) {
        String source = newEvent.getSource();
        List<AlertEvent> created = createdFrom(source, history);
        if (created.size() < minOccurrences) {
            return Optional.empty();
        }
        Map<Integer, Long> byHour = new TreeMap<>();
        for (AlertEvent event : created) {
            byHour.merge(event.getTimestamp().atZone(ZoneOffset.UTC).getHour(), 1L, Long::sum);
        }
        double averagePerHour = created.size() / 24.0;
        List<Integer> peakHours = byHour.entrySet().stream()
                .filter(entry -> entry.getValue() > averagePerHour * PEAK_FACTOR)
                .map(Map.Entry::getKey)
                .toList();
        if (peakHours.isEmpty()) {
            return Optional.empty();
        }
        List<AlertEvent> sourceEvents = history.stream()
                .filter(event -> source.equals(event.getSource()))
                .toList();
        return Optional.of(AlertPattern.builder()
                .id("time_pattern_" + source)
                .name("Time-based Pattern: " + source)
                .description("Alerts from " + source + " peak at hours " + peakHours + " UTC")
                .type(PatternType.TIME_OF_DAY)
                .criteria(PatternCriteria.builder()
                        .sources(Set.of(source))
                        .peakHours(peakHours)
                        .build())
                .confidence(Math.min(0.8, peakHours.size() / 8.0))
                .occurrences(created.size())
                .lastSeen(latest(created))
                .impact(impactOf(sourceEvents, created.size()))
                .recommendations(List.of(
                        "Consider time-based alert suppression during peak hours",
                        "Investigate if pattern correlates with usage patterns",
                        "Review scheduled tasks or batch jobs"))
                .build());
    }

    Optional<AlertPattern> severityEscalation(AlertEvent newEvent, List<AlertEvent> history) {
        List<AlertEvent> alertEvents = history.stream()
                .filter(event -> newEvent.getAlertId().equals(event.getAlertId()))
                .toList();
        if (alertEvents.size() < SEVERITY_ESCALATION_MIN_EVENTS || !strictlyIncreasing(alertEvents)) {
            return Optional.empty();
        }
        List<Severity> severities = alertEvents.stream().map(AlertEvent::getSeverity).toList();
        return Optional.of(AlertPattern.builder()
                .id("severity_escalation_" + newEvent.getAlertId())
                .name("Severity Escalation Pattern")
                .description("Severity of alert " + newEvent.getAlertId() + " rising: " + severities)
                .type(PatternType.SEVERITY_ESCALATION)
                .criteria(PatternCriteria.builder()
                        .severities(severities)
                        .correlatedAlertIds(List.of(newEvent.getAlertId()))
                        .build())
                .confidence(SEVERITY_ESCALATION_CONFIDENCE)
                .occurrences(alertEvents.size())
                .lastSeen(latest(alertEvents))
                .impact(PatternImpact.builder()
                        .averageBusinessImpact(AlertStatistics.average(AlertStatistics.scores(alertEvents)))
                        .escalationRate(100.0)
                        .build())
                .recommendations(List.of(
                        "Immediate escalation required",
                        "Review incident response procedures",
                        "Check if automated remediation is available"))
                .build());
    }

    // ========== Private Methods ==========

    private static boolean strictlyIncreasing(List<AlertEvent> events) {
        for (int i = 1; i < events.size(); i++) {
            Severity previous = events.get(i - 1).getSeverity();
            Severity current = events.get(i).getSeverity();
            if (previous == null || current == null || current.level() <= previous.level()) {
                return false;
            }
        }
        return true;
    }

    private static List<AlertEvent> createdFrom(String source, List<AlertEvent> history) {
        return history.stream()
                .filter(event -> event.getType() == AlertEventType.CREATED)
                .filter(event -> source != null && source.equals(event.getSource()))
                .toList();
    }

    private static PatternImpact impactOf(List<AlertEvent> sourceEvents, long createdCount) {
        long escalatedAlerts = sourceEvents.stream()
                .filter(event -> event.getType() == AlertEventType.ESCALATED)
                .map(AlertEvent::getAlertId)
                .distinct()
                .count();
        return PatternImpact.builder()
                .averageBusinessImpact(AlertStatistics.average(AlertStatistics.scores(sourceEvents)))
                .averageResolutionMillis(AlertStatistics.meanTimeToResolve(sourceEvents).orElse(0.0))
                .escalationRate(Math.min(100.0, AlertStatistics.percent(escalatedAlerts, createdCount)))
                .build();
    }

    private static Instant latest(List<AlertEvent> events) {
        return events.stream().map(AlertEvent::getTimestamp).max(Instant::compareTo).orElse(null);
    }
}
