package com.z254.butterfly.sentinel.exception;

import java.util.List;

/**
 * A single alert was rejected before entering the pipeline.
 */
public class AlertValidationException extends SentinelException {

    private final String alertId;
    private final List<String> violations;

    public AlertValidationException(String alertId, List<String> violations) {
        super("Invalid alert " + (alertId != null ? alertId : "<no id>") + ": " + String.join("; ", violations));
        this.alertId = alertId;
        this.violations = List.copyOf(violations);
    }

    public String getAlertId() {
        return alertId;
    }

    public List<String> getViolations() {
        return violations;
    }
}
