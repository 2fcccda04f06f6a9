package io.logscope.engine.model;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;

/**
 * One stored log entry. {@code httpStatus}, {@code httpMethod} and {@code uri} are
 * denormalised copies of the matching structured fields so they can be indexed.
 */
@Builder(toBuilder = true)
public record LogRecord(
        String id,
        OffsetDateTime timestamp,
        String level,
        String message,
        String source,
        String type,
        String raw,
        String agentId,
        String filePath,
        long lineNumber,
        Map<String, Object> fields,
        Map<String, String> labels,
        int httpStatus,
        String httpMethod,
        String uri
) {

    public LogRecord {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        labels = labels == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }
}
