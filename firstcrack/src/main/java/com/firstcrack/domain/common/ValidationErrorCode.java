package com.firstcrack.domain.common;

/**
 * Validation error codes for brew-start requests.
 */
public enum ValidationErrorCode {
    // Presence
    MISSING_FIELD("Required field is missing or not a number"),

    // Brew parameters
    INVALID_BREW_TYPE("Unsupported brew type"),
    DOSE_OUT_OF_RANGE("Dose must be between 10 and 30 grams"),
    TEMPERATURE_OUT_OF_RANGE("Target temperature must be between 85 and 100°C"),
    PRESSURE_OUT_OF_RANGE("Target pressure must be between 5 and 15 bar"),

    // Optional timings
    PREINFUSION_OUT_OF_RANGE("Pre-infusion duration must be between 0 and 30 seconds"),
    EXTRACTION_OUT_OF_RANGE("Extraction time must be between 15 and 60 seconds"),

    // Transport
    INVALID_DEVICE_ADDRESS("Device address is missing or not a valid push token");

    private final String message;

    ValidationErrorCode(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
