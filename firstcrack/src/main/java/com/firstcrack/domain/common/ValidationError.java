package com.firstcrack.domain.common;

/**
 * One field-level validation failure.
 *
 * @param code     error code
 * @param field    request field name as the caller sent it
 * @param message  human readable reason
 * @param rejected offending value, may be null when the field was absent
 */
public record ValidationError(
    ValidationErrorCode code,
    String field,
    String message,
    Object rejected
) {
    public static ValidationError of(ValidationErrorCode code, String field, Object rejected) {
        return new ValidationError(code, field, code.getMessage(), rejected);
    }

    public static ValidationError of(ValidationErrorCode code, String field, String message, Object rejected) {
        return new ValidationError(code, field, message, rejected);
    }
}
