package com.firstcrack.service.brew;

import com.firstcrack.domain.brew.BrewRequest;
import com.firstcrack.domain.brew.BrewType;
import com.firstcrack.domain.common.ValidationErrorCode;
import com.firstcrack.domain.common.ValidationResult;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Field-level validation of brew-start requests.
 *
 * Every field is checked; the result lists all failures, not just the first.
 * Field names in errors are the request field names used on the HTTP API.
 *
 * Rules:
 * - brewType: espresso, lungo, ristretto or americano
 * - dose: 10-30 g
 * - targetTemp: 85-100 °C
 * - targetPressure: 5-15 bar
 * - preinfusionDuration (optional): 0-30 s
 * - extractionTime (optional): 15-60 s
 * - deviceToken: non-empty, token characters only, at most 4096 chars
 */
public class BrewRequestValidator {

    public static final String FIELD_BREW_TYPE = "brewType";
    public static final String FIELD_DOSE = "dose";
    public static final String FIELD_TEMPERATURE = "targetTemp";
    public static final String FIELD_PRESSURE = "targetPressure";
    public static final String FIELD_PREINFUSION = "preinfusionDuration";
    public static final String FIELD_EXTRACTION = "extractionTime";
    public static final String FIELD_DEVICE = "deviceToken";

    private static final Pattern DEVICE_ADDRESS_PATTERN = Pattern.compile("^[A-Za-z0-9:_\\-.]+$");
    private static final int MAX_DEVICE_ADDRESS_LENGTH = 4096;

    private static final BigDecimal MIN_DOSE = BigDecimal.valueOf(10);
    private static final BigDecimal MAX_DOSE = BigDecimal.valueOf(30);
    private static final BigDecimal MIN_TEMP = BigDecimal.valueOf(85);
    private static final BigDecimal MAX_TEMP = BigDecimal.valueOf(100);
    private static final BigDecimal MIN_PRESSURE = BigDecimal.valueOf(5);
    private static final BigDecimal MAX_PRESSURE = BigDecimal.valueOf(15);

    public ValidationResult validate(BrewRequest request) {
        ValidationResult.Builder result = new ValidationResult.Builder();
        if (request == null) {
            return result.addError(ValidationErrorCode.MISSING_FIELD, "request", null).build();
        }

        if (request.brewType() == null || request.brewType().isBlank()) {
            result.addError(ValidationErrorCode.MISSING_FIELD, FIELD_BREW_TYPE, request.brewType());
        } else if (BrewType.fromWire(request.brewType()).isEmpty()) {
            result.addError(ValidationErrorCode.INVALID_BREW_TYPE, FIELD_BREW_TYPE,
                "Brew type must be one of: " + BrewType.allowedValues(), request.brewType());
        }

        checkRange(result, request.doseGrams(), MIN_DOSE, MAX_DOSE,
            ValidationErrorCode.DOSE_OUT_OF_RANGE, FIELD_DOSE);
        checkRange(result, request.targetTempC(), MIN_TEMP, MAX_TEMP,
            ValidationErrorCode.TEMPERATURE_OUT_OF_RANGE, FIELD_TEMPERATURE);
        checkRange(result, request.targetPressureBar(), MIN_PRESSURE, MAX_PRESSURE,
            ValidationErrorCode.PRESSURE_OUT_OF_RANGE, FIELD_PRESSURE);

        Integer preinfusion = request.preinfusionSeconds();
        if (preinfusion != null && (preinfusion < 0 || preinfusion > 30)) {
            result.addError(ValidationErrorCode.PREINFUSION_OUT_OF_RANGE, FIELD_PREINFUSION, preinfusion);
        }
        Integer extraction = request.extractionSeconds();
        if (extraction != null && (extraction < 15 || extraction > 60)) {
            result.addError(ValidationErrorCode.EXTRACTION_OUT_OF_RANGE, FIELD_EXTRACTION, extraction);
        }

        if (!isValidDeviceAddress(request.deviceAddress())) {
            // the token itself is never echoed back
            result.addError(ValidationErrorCode.INVALID_DEVICE_ADDRESS, FIELD_DEVICE, null);
        }

        return result.build();
    }

    public boolean isValidDeviceAddress(String deviceAddress) {
        return deviceAddress != null
            && !deviceAddress.isBlank()
            && deviceAddress.length() <= MAX_DEVICE_ADDRESS_LENGTH
            && DEVICE_ADDRESS_PATTERN.matcher(deviceAddress).matches();
    }

    private static void checkRange(ValidationResult.Builder result, BigDecimal value,
                                   BigDecimal min, BigDecimal max,
                                   ValidationErrorCode code, String field) {
        if (value == null) {
            result.addError(ValidationErrorCode.MISSING_FIELD, field, null);
        } else if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
            result.addError(code, field, value);
        }
    }
}
