package io.logscope.engine.query;

/**
 * Base type for every failure raised while turning user filter text into SQL.
 */
public class QueryExpressionException extends RuntimeException {

    public QueryExpressionException(String message) {
        super(message);
    }

    public QueryExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
