package io.logscope.engine.model;

import io.logscope.engine.query.sql.CompiledFilter;
import java.time.OffsetDateTime;
import java.util.List;
import lombok.Builder;

/**
 * Search criteria for the log table. When {@code expression} is set it replaces every flat
 * filter below it, free text included; the time range always applies.
 */
@Builder(toBuilder = true)
public record LogFilter(
        OffsetDateTime from,
        OffsetDateTime to,
        String agentId,
        String level,
        List<String> levels,
        String type,
        List<String> types,
        String source,
        String filePath,
        String search,
        SearchMode searchMode,
        CompiledFilter expression,
        int page,
        int pageSize,
        LogSortField sortBy,
        boolean ascending
) {

    public static final int DEFAULT_PAGE_SIZE = 50;

    public LogFilter {
        levels = levels == null ? List.of() : List.copyOf(levels);
        types = types == null ? List.of() : List.copyOf(types);
        searchMode = searchMode == null ? SearchMode.TOKEN : searchMode;
        sortBy = sortBy == null ? LogSortField.TIMESTAMP : sortBy;
        page = Math.max(page, 1);
        pageSize = pageSize <= 0 ? DEFAULT_PAGE_SIZE : pageSize;
    }

    public int limit() {
        return pageSize;
    }

    public long offset() {
        return (long) (page - 1) * pageSize;
    }

    public boolean hasExpression() {
        return expression != null;
    }
}
