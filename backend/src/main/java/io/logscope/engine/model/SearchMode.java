package io.logscope.engine.model;

import java.util.Locale;

/**
 * How free text is matched against the message column.
 */
public enum SearchMode {
    /** Single token match backed by the token bloom filter index. */
    TOKEN,
    /** Raw substring match, bypasses the token index. */
    SUBSTRING,
    /** Every whitespace-separated word must appear as a token, in any order. */
    PHRASE;

    public static SearchMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return TOKEN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown search mode: " + value, e);
        }
    }
}
