package io.logscope.engine.service;

import io.logscope.engine.model.LogLevel;
import io.logscope.engine.model.LogRecord;
import io.logscope.engine.service.dto.IngestSummary;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Normalises incoming records and hands them to the {@link LogBuffer}.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "app.clickhouse", name = "enabled", havingValue = "true")
public class LogIngestService {

    private final LogBuffer buffer;
    private final LogRecordReader reader;

    public LogIngestService(LogBuffer buffer, LogRecordReader reader) {
        this.buffer = buffer;
        this.reader = reader;
    }

    public IngestSession startSession(String origin, String agentId) {
        return new IngestSession(UUID.randomUUID().toString(), origin, agentId);
    }

    public void ingestLine(IngestSession session, String raw) {
        session.total++;
        if (buffer.isClosed()) {
            session.failed++;
            log.warn("Log buffer is closed, line not ingested");
            return;
        }
        try {
            LogRecord record = reader.read(raw);
            buffer.add(normalize(record, session.agentId, session.origin));
            session.accepted++;
        } catch (RuntimeException e) {
            session.failed++;
            log.warn("Failed to ingest line: {}", e.getMessage());
        }
    }

    public IngestSummary finish(IngestSession session) {
        IngestSummary summary = new IngestSummary(session.sessionId, session.origin,
                session.total, session.accepted, session.failed);
        log.info("Ingest session {} from '{}' finished: total={}, accepted={}, failed={}",
                summary.sessionId(), summary.origin(), summary.total(), summary.accepted(), summary.failed());
        return summary;
    }

    /** Enqueues already structured records and returns how many were accepted. */
    public int ingest(List<LogRecord> records) {
        if (records == null || records.isEmpty()) return 0;
        List<LogRecord> normalized = new ArrayList<>(records.size());
        for (LogRecord record : records) {
            normalized.add(normalize(record, null, null));
        }
        buffer.add(normalized);
        return normalized.size();
    }

    LogRecord normalize(LogRecord record, String defaultAgentId, String defaultFilePath) {
        LogRecord.LogRecordBuilder builder = record.toBuilder()
                .id(StringUtils.hasText(record.id()) ? record.id() : UUID.randomUUID().toString())
                .timestamp(record.timestamp() != null ? record.timestamp() : OffsetDateTime.now(ZoneOffset.UTC))
                .level(LogLevel.parse(record.level()).value())
                .type(StringUtils.hasText(record.type()) ? record.type().toLowerCase(Locale.ROOT) : "");

        if (!StringUtils.hasText(record.agentId()) && StringUtils.hasText(defaultAgentId)) {
            builder.agentId(defaultAgentId);
        }
        if (!StringUtils.hasText(record.filePath()) && StringUtils.hasText(defaultFilePath)) {
            builder.filePath(defaultFilePath);
        }

        Map<String, Object> fields = record.fields();
        if (record.httpStatus() == 0) {
            builder.httpStatus(parseStatus(fields.get("status")));
        }
        if (!StringUtils.hasText(record.httpMethod()) && fields.get("method") != null) {
            builder.httpMethod(String.valueOf(fields.get("method")).toUpperCase(Locale.ROOT));
        }
        if (!StringUtils.hasText(record.uri()) && fields.get("request_uri") != null) {
            builder.uri(String.valueOf(fields.get("request_uri")));
        }
        return builder.build();
    }

    private int parseStatus(Object value) {
        if (value instanceof Number number) {
            return validStatus(number.intValue());
        }
        if (value instanceof String text && StringUtils.hasText(text)) {
            try {
                return validStatus(Integer.parseInt(text.trim()));
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric status field '{}'", text);
            }
        }
        return 0;
    }

    private static int validStatus(int status) {
        return status >= 100 && status <= 599 ? status : 0;
    }

    @Getter
    public static class IngestSession {
        private final String sessionId;
        private final String origin;
        private final String agentId;
        private long total;
        private long accepted;
        private long failed;

        public IngestSession(String sessionId, String origin, String agentId) {
            this.sessionId = sessionId;
            this.origin = origin;
            this.agentId = agentId;
        }
    }
}
