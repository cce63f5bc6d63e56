package com.firstcrack.domain.brew;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Per-brew correlation and parameter record.
 *
 * Created once a request has been validated, read by the scheduler and the
 * payload builder for the whole timeline, then dropped. {@code brewId} doubles
 * as the update tag on every notification surface.
 */
public record BrewContext(
    String brewId,
    String deviceAddress,
    BrewType brewType,
    BigDecimal doseGrams,
    BigDecimal targetTempC,
    BigDecimal targetPressureBar,
    int preinfusionSeconds,
    int extractionSeconds,
    Instant startTime
) {
    public BrewContext {
        if (brewId == null || brewId.isBlank()) {
            throw new IllegalArgumentException("brewId cannot be null or empty");
        }
        if (deviceAddress == null || deviceAddress.isBlank()) {
            throw new IllegalArgumentException("deviceAddress cannot be null or empty");
        }
        if (brewType == null) {
            throw new IllegalArgumentException("brewType cannot be null");
        }
        if (doseGrams == null || targetTempC == null || targetPressureBar == null) {
            throw new IllegalArgumentException("Brewing parameters cannot be null");
        }
        if (startTime == null) {
            throw new IllegalArgumentException("startTime cannot be null");
        }
    }

    /**
     * Absolute wall-clock time at which a stage with the given offset fires.
     */
    public Instant fireTimeFor(int offsetSeconds) {
        return startTime.plusSeconds(offsetSeconds);
    }
}
