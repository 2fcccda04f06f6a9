package io.logscope.engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.logscope.engine.model.LogRecord;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Turns one line of agent output into a {@link LogRecord}. JSON objects are mapped field by
 * field; anything else is kept as a plain text message.
 */
@Component
public class LogRecordReader {

    // --- Field name dictionaries ---------------------------------------------------------------

    private static final List<String> TIMESTAMP_FIELDS = List.of("timestamp", "@timestamp", "time", "ts");
    private static final List<String> LEVEL_FIELDS = List.of("level", "severity", "lvl", "@level");
    private static final List<String> MESSAGE_FIELDS = List.of("message", "msg", "@message");

    private static final Set<String> RESERVED_FIELDS = Set.of(
            "timestamp", "@timestamp", "time", "ts", "level", "severity", "lvl", "@level",
            "message", "msg", "@message", "id", "source", "type", "raw", "agent_id", "file_path",
            "line_number", "fields", "labels", "http_status", "http_method", "uri");

    // --- Regexes -------------------------------------------------------------------------------

    // ISO-8601 at the start of the line (with Z or offset)
    private static final Pattern ISO_PREFIX = Pattern.compile(
            "^(\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?(?:Z|[+-]\\d{2}:?\\d{2}))");

    private static final Pattern LEVEL_WORD = Pattern.compile(
            "\\b(TRACE|DEBUG|INFO|NOTICE|WARN|WARNING|ERROR|ERR|FATAL|CRITICAL|CRIT|PANIC)\\b",
            Pattern.CASE_INSENSITIVE);

    private final ObjectMapper objectMapper;

    public LogRecordReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // --- Public API ----------------------------------------------------------------------------

    public LogRecord read(String line) {
        if (!StringUtils.hasText(line)) {
            throw new IllegalArgumentException("empty log line");
        }
        JsonNode root = tryParseJson(line).orElse(null);
        if (root instanceof ObjectNode objectNode) {
            return readJson(objectNode, line);
        }
        return readPlain(line);
    }

    // --- JSON path -----------------------------------------------------------------------------

    private LogRecord readJson(ObjectNode node, String line) {
        LogRecord.LogRecordBuilder builder = LogRecord.builder()
                .id(text(node, "id"))
                .timestamp(findTimestamp(node).orElse(null))
                .level(findFirstString(node, LEVEL_FIELDS).orElse(null))
                .message(findFirstString(node, MESSAGE_FIELDS).orElse(""))
                .source(text(node, "source"))
                .type(text(node, "type"))
                .raw(Optional.ofNullable(text(node, "raw")).orElse(line))
                .agentId(text(node, "agent_id"))
                .filePath(text(node, "file_path"))
                .lineNumber(node.path("line_number").asLong(0))
                .httpStatus(node.path("http_status").asInt(0))
                .httpMethod(text(node, "http_method"))
                .uri(text(node, "uri"));

        JsonNode fields = node.get("fields");
        builder.fields(fields != null && fields.isObject() ? toMap(fields) : extractAttributes(node));

        JsonNode labels = node.get("labels");
        if (labels != null && labels.isObject()) {
            Map<String, String> values = new LinkedHashMap<>();
            labels.fields().forEachRemaining(e -> values.put(e.getKey(), e.getValue().asText()));
            builder.labels(values);
        }
        return builder.build();
    }

    // --- Plain text path -----------------------------------------------------------------------

    private LogRecord readPlain(String line) {
        return LogRecord.builder()
                .timestamp(extractTimestampFromText(line).orElse(null))
                .level(extractLevelFromText(line).orElse(null))
                .message(line)
                .raw(line)
                .build();
    }

    // --- Helpers -------------------------------------------------------------------------------

    private Optional<JsonNode> tryParseJson(String raw) {
        String trimmed = raw.trim();
        if (!trimmed.startsWith("{")) return Optional.empty();
        try {
            return Optional.ofNullable(objectMapper.readTree(trimmed));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private Optional<OffsetDateTime> findTimestamp(ObjectNode node) {
        for (String field : TIMESTAMP_FIELDS) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode()) {
                Optional<OffsetDateTime> parsed = parseTimestampNode(value);
                if (parsed.isPresent()) return parsed;
            }
        }
        return Optional.empty();
    }

    private Optional<OffsetDateTime> parseTimestampNode(JsonNode node) {
        if (node.isNumber()) {
            long epochMillis = node.asLong();
            if (String.valueOf(Math.abs(epochMillis)).length() <= 10) {
                epochMillis *= 1000;
            }
            return Optional.of(OffsetDateTime.ofInstant(Instant.ofEpochMilli(epochMillis), ZoneOffset.UTC));
        }
        if (node.isTextual()) {
            String text = node.asText();
            try {
                return Optional.of(OffsetDateTime.parse(text));
            } catch (DateTimeParseException e) {
                return extractTimestampFromText(text);
            }
        }
        return Optional.empty();
    }

    private Optional<OffsetDateTime> extractTimestampFromText(String raw) {
        Matcher matcher = ISO_PREFIX.matcher(raw.trim());
        if (matcher.find()) {
            String iso = matcher.group(1).replace(' ', 'T');
            try {
                return Optional.of(OffsetDateTime.parse(iso));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private Optional<String> extractLevelFromText(String raw) {
        Matcher matcher = LEVEL_WORD.matcher(raw);
        return matcher.find() ? Optional.of(matcher.group(1).toLowerCase(Locale.ROOT)) : Optional.empty();
    }

    private Optional<String> findFirstString(ObjectNode node, List<String> names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && value.isValueNode()) {
                String text = value.asText(null);
                if (StringUtils.hasText(text)) return Optional.of(text);
            }
        }
        return Optional.empty();
    }

    private Map<String, Object> extractAttributes(ObjectNode node) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (!RESERVED_FIELDS.contains(entry.getKey())) {
                attributes.put(entry.getKey(), objectMapper.convertValue(entry.getValue(), Object.class));
            }
        }
        return attributes;
    }

    private Map<String, Object> toMap(JsonNode node) {
        Map<String, Object> values = new LinkedHashMap<>();
        node.fields().forEachRemaining(e -> values.put(e.getKey(), objectMapper.convertValue(e.getValue(), Object.class)));
        return values;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }
}
