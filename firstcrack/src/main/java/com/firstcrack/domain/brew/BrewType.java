package com.firstcrack.domain.brew;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Supported brew methods.
 */
public enum BrewType {
    ESPRESSO("espresso"),
    LUNGO("lungo"),
    RISTRETTO("ristretto"),
    AMERICANO("americano");

    private final String wireValue;

    BrewType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Optional<BrewType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        for (BrewType type : values()) {
            if (type.wireValue.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Comma separated wire values, used in validation messages.
     */
    public static String allowedValues() {
        return Arrays.stream(values()).map(BrewType::wireValue).collect(Collectors.joining(", "));
    }
}
