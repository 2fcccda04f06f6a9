package io.logscope.engine.model;

import java.util.Locale;

/**
 * Bucket width for the volume time series, mapped to the ClickHouse rounding function.
 */
public enum VolumeInterval {
    MINUTE("toStartOfMinute"),
    HOUR("toStartOfHour"),
    DAY("toStartOfDay");

    private final String function;

    VolumeInterval(String function) {
        this.function = function;
    }

    public String function() {
        return function;
    }

    public static VolumeInterval fromString(String value) {
        if (value == null || value.isBlank()) {
            return HOUR;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unsupported volume interval: " + value, e);
        }
    }
}
