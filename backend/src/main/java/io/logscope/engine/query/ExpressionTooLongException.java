package io.logscope.engine.query;

public class ExpressionTooLongException extends QueryExpressionException {

    private final int length;
    private final int limit;

    public ExpressionTooLongException(int length, int limit) {
        super("filter expression too long: " + length + " characters (max " + limit + ")");
        this.length = length;
        this.limit = limit;
    }

    public int getLength() {
        return length;
    }

    public int getLimit() {
        return limit;
    }
}
