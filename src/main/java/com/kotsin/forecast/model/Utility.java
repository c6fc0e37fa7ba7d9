package com.kotsin.forecast.model;

import java.util.Locale;

/**
 * Utility - Metered commodity a consumption series belongs to.
 */
public enum Utility {
    ELECTRICITY,
    GAS,
    WATER,
    STEAM,
    CHILLED_WATER,
    HEATING_HOT_WATER,
    SOLAR,
    OIL;

    /**
     * Parse a utility code as it appears in the contract table ("electricity", "Chilled Water", ...).
     *
     * @throws IllegalArgumentException for unknown codes
     */
    public static Utility fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Utility code is blank");
        }
        String normalized = code.trim()
                .toUpperCase(Locale.ROOT)
                .replace(' ', '_')
                .replace('-', '_');
        return Utility.valueOf(normalized);
    }
}
