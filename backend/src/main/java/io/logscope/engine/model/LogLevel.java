package io.logscope.engine.model;

import java.util.Locale;

/**
 * Canonical severities. Incoming level strings are folded onto these, e.g. {@code warn}
 * becomes {@code warning} and {@code crit} becomes {@code fatal}.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARNING,
    ERROR,
    FATAL,
    UNKNOWN;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LogLevel parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "trace":
            case "debug":
                return DEBUG;
            case "info":
            case "notice":
            case "information":
                return INFO;
            case "warn":
            case "warning":
                return WARNING;
            case "err":
            case "error":
                return ERROR;
            case "fatal":
            case "critical":
            case "crit":
            case "emergency":
            case "emerg":
            case "alert":
            case "panic":
                return FATAL;
            default:
                return UNKNOWN;
        }
    }
}
