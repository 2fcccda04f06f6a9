package io.logscope.engine.repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record SqlStatement(String sql, List<Object> args) {

    public SqlStatement {
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }

    public Object[] argsArray() {
        return args.toArray();
    }
}
