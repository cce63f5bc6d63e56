package com.firstcrack.domain.brew;

import java.math.BigDecimal;

/**
 * Raw brew-start parameters as received from a caller.
 *
 * Fields are nullable: nothing here is trusted until it has passed
 * {@code BrewRequestValidator}. The optional timing fields fall back to
 * {@link #DEFAULT_PREINFUSION_SECONDS} and {@link #DEFAULT_EXTRACTION_SECONDS}.
 */
public record BrewRequest(
    String brewType,
    BigDecimal doseGrams,
    BigDecimal targetTempC,
    BigDecimal targetPressureBar,
    String deviceAddress,
    Integer preinfusionSeconds,
    Integer extractionSeconds
) {
    public static final int DEFAULT_PREINFUSION_SECONDS = 8;
    public static final int DEFAULT_EXTRACTION_SECONDS = 28;

    public static BrewRequest of(String brewType, int doseGrams, int targetTempC,
                                 int targetPressureBar, String deviceAddress) {
        return new BrewRequest(brewType,
            BigDecimal.valueOf(doseGrams),
            BigDecimal.valueOf(targetTempC),
            BigDecimal.valueOf(targetPressureBar),
            deviceAddress,
            null,
            null);
    }

    public int effectivePreinfusionSeconds() {
        return preinfusionSeconds != null ? preinfusionSeconds : DEFAULT_PREINFUSION_SECONDS;
    }

    public int effectiveExtractionSeconds() {
        return extractionSeconds != null ? extractionSeconds : DEFAULT_EXTRACTION_SECONDS;
    }
}
