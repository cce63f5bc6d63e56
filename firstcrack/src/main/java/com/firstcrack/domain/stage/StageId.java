package com.firstcrack.domain.stage;

import java.util.Optional;

/**
 * Brew lifecycle stages. Declaration order is lifecycle order.
 */
public enum StageId {
    HEATING("heating"),
    GRINDING("grinding"),
    PRE_INFUSION("pre_infusion"),
    BREWING("brewing"),
    COMPLETE("complete");

    private final String wireValue;

    StageId(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public boolean isBefore(StageId other) {
        return compareTo(other) < 0;
    }

    public static Optional<StageId> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (StageId stage : values()) {
            if (stage.wireValue.equals(value)) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }
}
