package io.logscope.engine.query.parser;

import io.logscope.engine.query.QueryExpressionException;

/**
 * Raised when an expression is empty, syntactically invalid, references an unknown field or
 * does not produce a boolean at its root.
 */
public class ParseException extends QueryExpressionException {

    private final int position;

    public ParseException(String message) {
        this(message, -1);
    }

    public ParseException(String message, int position) {
        super(position >= 0 ? message + " (at position " + position + ")" : message);
        this.position = position;
    }

    /** Zero-based character offset of the offending token, or -1 when not tied to one. */
    public int getPosition() {
        return position;
    }
}
