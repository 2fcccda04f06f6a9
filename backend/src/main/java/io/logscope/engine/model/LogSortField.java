package io.logscope.engine.model;

import java.util.Locale;

public enum LogSortField {
    TIMESTAMP("timestamp"),
    LEVEL("level");

    private final String column;

    LogSortField(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }

    public static LogSortField fromString(String value) {
        if (value == null || value.isBlank()) {
            return TIMESTAMP;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unsupported sort field: " + value, e);
        }
    }
}
