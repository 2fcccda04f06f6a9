package io.logscope.engine.query;

import java.util.Locale;
import java.util.Set;

/**
 * A field the filter language can reference: its ClickHouse column, value type and the
 * operators it accepts.
 */
public record FieldDefinition(String name, String column, FieldType type, Set<String> operators) {

    public FieldDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("field name must not be blank");
        }
        column = column == null || column.isBlank() ? name : column;
        type = type == null ? FieldType.STRING : type;
        operators = operators == null ? Set.of() : Set.copyOf(operators);
    }

    public boolean allows(String operator) {
        return operators.contains(operator);
    }

    public boolean isJson() {
        return type == FieldType.JSON;
    }

    /** String columns are compared case-insensitively, so the column is wrapped in lower(). */
    public boolean isCaseInsensitive() {
        return type == FieldType.STRING;
    }

    @Override
    public String toString() {
        return name + ":" + type.name().toLowerCase(Locale.ROOT);
    }
}
