package io.logscope.engine.query.sql;

import io.logscope.engine.query.QueryExpressionException;

/**
 * Raised when a parsed expression cannot be translated: illegal operator for a field,
 * incompatible literal, rejected regex or duration, unsupported function or member access.
 */
public class CompileException extends QueryExpressionException {

    public CompileException(String message) {
        super(message);
    }

    public CompileException(String message, Throwable cause) {
        super(message, cause);
    }
}
