package com.z254.butterfly.sentinel.pipeline;

import com.z254.butterfly.sentinel.domain.model.Alert;
import com.z254.butterfly.sentinel.exception.AlertValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Checks the constraints declared on {@link Alert} before it touches any engine state.
 */
@Component
public class AlertValidator {

    private final Validator validator;

    public AlertValidator(Validator validator) {
        this.validator = validator;
    }

    /**
     * @throws AlertValidationException listing every violation found
     */
    public void validate(Alert alert) {
        if (alert == null) {
            throw new AlertValidationException(null, List.of("alert is required"));
        }
        Set<ConstraintViolation<Alert>> violations = validator.validate(alert);
        if (!violations.isEmpty()) {
            List<String> messages = violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .toList();
            throw new AlertValidationException(alert.getId(), messages);
        }
    }
}
