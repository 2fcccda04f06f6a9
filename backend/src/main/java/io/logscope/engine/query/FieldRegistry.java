package io.logscope.engine.query;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable catalogue of the fields a filter expression may reference.
 */
public final class FieldRegistry {

    private static final FieldRegistry DEFAULTS = new FieldRegistry(List.of(
            field("level", FieldType.STRING, "==", "!=", "in"),
            field("message", FieldType.STRING, "==", "!=", "contains", "startsWith", "endsWith", "matches"),
            field("source", FieldType.STRING, "==", "!=", "in", "contains"),
            field("type", FieldType.STRING, "==", "!=", "in"),
            field("agent_id", FieldType.STRING, "==", "!=", "in"),
            field("file_path", FieldType.STRING, "==", "!=", "contains", "startsWith", "endsWith"),
            field("timestamp", FieldType.TIME, ">=", "<=", ">", "<"),
            field("http_status", FieldType.INT, "==", "!=", ">=", "<=", ">", "<", "in"),
            field("http_method", FieldType.STRING, "==", "!=", "in"),
            field("uri", FieldType.STRING, "==", "!=", "contains", "startsWith", "endsWith", "matches"),
            field("fields", FieldType.JSON, "==", "!=", ">=", "<=", ">", "<", "in", "contains"),
            field("labels", FieldType.JSON, "==", "!=", "in", "contains")
    ));

    private final Map<String, FieldDefinition> fields;

    public FieldRegistry(Collection<FieldDefinition> definitions) {
        Map<String, FieldDefinition> byName = new LinkedHashMap<>();
        for (FieldDefinition definition : definitions) {
            if (byName.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalArgumentException("duplicate field definition: " + definition.name());
            }
        }
        this.fields = Collections.unmodifiableMap(byName);
    }

    public static FieldRegistry defaults() {
        return DEFAULTS;
    }

    public Optional<FieldDefinition> lookup(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public boolean contains(String name) {
        return fields.containsKey(name);
    }

    public Collection<FieldDefinition> fields() {
        return fields.values();
    }

    private static FieldDefinition field(String name, FieldType type, String... operators) {
        return new FieldDefinition(name, name, type, Set.of(operators));
    }
}
