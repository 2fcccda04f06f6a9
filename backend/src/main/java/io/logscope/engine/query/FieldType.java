package io.logscope.engine.query;

/**
 * Value kind of a queryable log field. Drives literal compatibility checks and
 * whether the field may be addressed with member access ({@code fields.status}).
 */
public enum FieldType {
    STRING,
    INT,
    FLOAT,
    TIME,
    JSON;

    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }
}
