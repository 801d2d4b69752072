package com.z254.butterfly.sentinel.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging utility for SENTINEL.
 * <p>
 * Emits {@code message | data={...}} lines with MDC context for the alert, group and
 * escalation being processed.
 */
@Slf4j
@Component
public class SentinelStructuredLogger {

    // MDC keys
    public static final String MDC_ALERT_ID = "alertId";
    public static final String MDC_GROUP_ID = "groupId";
    public static final String MDC_ESCALATION_ID = "escalationId";
    public static final String MDC_COMPONENT = "component";

    /**
     * Log an alert lifecycle event.
     */
    public void logAlertEvent(String alertId, AlertLogEvent eventType, String message,
                              Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_ALERT_ID, alertId != null ? alertId : ""))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("alertId", alertId);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case REJECTED, STEP_FAILED -> log.warn("{} | data={}", message, formatLogData(logData));
                case GROUPED, SCORED, ENRICHED -> log.debug("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log an escalation lifecycle event.
     */
    public void logEscalationEvent(String escalationId, String alertId, EscalationLogEvent eventType,
                                   String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(
                MDC_ESCALATION_ID, escalationId,
                MDC_ALERT_ID, alertId != null ? alertId : ""))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("escalationId", escalationId);
            logData.put("alertId", alertId);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case EXHAUSTED -> log.error("{} | data={}", message, formatLogData(logData));
                case NOTIFICATION_FAILED -> log.warn("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a detected pattern.
     */
    public void logPattern(String patternId, String patternType, double confidence, int occurrences) {
        Map<String, Object> logData = new HashMap<>();
        logData.put("event", "PATTERN_DETECTED");
        logData.put("patternId", patternId);
        logData.put("patternType", patternType);
        logData.put("confidence", confidence);
        logData.put("occurrences", occurrences);
        log.info("Pattern detected | data={}", formatLogData(logData));
    }

    /**
     * Log a performance measurement; slow operations are logged at WARN.
     */
    public void logPerformance(String operation, Duration duration, Duration budget,
                               Map<String, Object> details) {
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("event", "PERFORMANCE");
        logData.put("operation", operation);
        logData.put("durationMs", duration.toMillis());
        logData.put("budgetMs", budget.toMillis());
        if (details != null) {
            logData.putAll(details);
        }

        if (duration.compareTo(budget) > 0) {
            log.warn("Slow operation: {} took {}ms | data={}",
                    operation, duration.toMillis(), formatLogData(logData));
        } else {
            log.debug("Performance: {} completed in {}ms | data={}",
                    operation, duration.toMillis(), formatLogData(logData));
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    private String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    // ========== Event Type Enums ==========

    public enum AlertLogEvent {
        RECEIVED, REJECTED, GROUPED, SUPPRESSED, SCORED, ENRICHED, ESCALATED, PROCESSED, STEP_FAILED
    }

    public enum EscalationLogEvent {
        STARTED, STEP_EXECUTED, NOTIFICATION_FAILED, ACKNOWLEDGED, RESOLVED, CANCELLED, EXHAUSTED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
