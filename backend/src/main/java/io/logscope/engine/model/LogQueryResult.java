package io.logscope.engine.model;

import java.util.List;

public record LogQueryResult(List<LogRecord> entries, long total, boolean hasMore) {

    public LogQueryResult {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
