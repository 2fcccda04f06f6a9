package io.logscope.engine.query.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A ClickHouse boolean condition with {@code ?} placeholders and their values, in order.
 */
public record CompiledFilter(String sql, List<Object> args) {

    public CompiledFilter {
        if (sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("compiled filter sql must not be blank");
        }
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }
}
