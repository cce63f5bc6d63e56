package com.firstcrack.service.brew;

import com.firstcrack.domain.common.ValidationError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception thrown when a brew-start request fails validation. No brew is
 * created.
 */
public class BrewValidationException extends RuntimeException {

    private final List<ValidationError> errors;

    public BrewValidationException(List<ValidationError> errors) {
        super("Invalid brew request: " + errors.stream()
            .map(e -> e.field() + " (" + e.message() + ")")
            .collect(Collectors.joining(", ")));
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> getErrors() {
        return errors;
    }
}
