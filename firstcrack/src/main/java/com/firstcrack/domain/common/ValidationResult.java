package com.firstcrack.domain.common;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of request validation.
 */
public record ValidationResult(
    boolean passed,
    List<ValidationError> errors
) {
    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public static ValidationResult pass() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult fail(List<ValidationError> errors) {
        return new ValidationResult(false, errors);
    }

    /**
     * Builder for accumulating errors.
     */
    public static class Builder {
        private final List<ValidationError> errors = new ArrayList<>();

        public Builder addError(ValidationErrorCode code, String field, Object rejected) {
            errors.add(ValidationError.of(code, field, rejected));
            return this;
        }

        public Builder addError(ValidationErrorCode code, String field, String message, Object rejected) {
            errors.add(ValidationError.of(code, field, message, rejected));
            return this;
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }

        public ValidationResult build() {
            return errors.isEmpty() ? pass() : fail(errors);
        }
    }
}
