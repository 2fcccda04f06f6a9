package io.logscope.engine.service.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Raw search input as received from a caller. {@code expression} takes precedence over every
 * flat filter, {@code query} included.
 */
public record QueryParameters(
        int page,
        int size,
        Optional<OffsetDateTime> from,
        Optional<OffsetDateTime> to,
        Optional<String> agentId,
        List<String> levels,
        List<String> types,
        Optional<String> source,
        Optional<String> filePath,
        Optional<String> query,
        Optional<String> searchMode,
        Optional<String> expression,
        Optional<String> sortBy,
        boolean sortDesc) {

    public QueryParameters {
        from = from == null ? Optional.empty() : from;
        to = to == null ? Optional.empty() : to;
        agentId = agentId == null ? Optional.empty() : agentId;
        levels = levels == null ? List.of() : List.copyOf(levels);
        types = types == null ? List.of() : List.copyOf(types);
        source = source == null ? Optional.empty() : source;
        filePath = filePath == null ? Optional.empty() : filePath;
        query = query == null ? Optional.empty() : query;
        searchMode = searchMode == null ? Optional.empty() : searchMode;
        expression = expression == null ? Optional.empty() : expression;
        sortBy = sortBy == null ? Optional.empty() : sortBy;
    }
}
