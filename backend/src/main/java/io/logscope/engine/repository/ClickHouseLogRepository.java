package io.logscope.engine.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.logscope.engine.model.AggregationFilter;
import io.logscope.engine.model.ErrorRateResult;
import io.logscope.engine.model.HttpStatsResult;
import io.logscope.engine.model.LogFilter;
import io.logscope.engine.model.LogQueryResult;
import io.logscope.engine.model.LogRecord;
import io.logscope.engine.model.SourceCount;
import io.logscope.engine.model.UriCount;
import io.logscope.engine.model.VolumeInterval;
import io.logscope.engine.model.VolumePoint;
import java.nio.charset.StandardCharsets;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Slf4j
@Repository
@ConditionalOnProperty(prefix = "app.clickhouse", name = "enabled", havingValue = "true")
public class ClickHouseLogRepository implements LogRepository {

    static final String INSERT_SQL = "INSERT INTO " + LogStatementBuilder.TABLE + " ("
            + LogStatementBuilder.SELECT_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final TypeReference<Map<String, Object>> FIELDS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, String>> LABELS_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbc;
    private final LogStatementBuilder statements;
    private final ObjectMapper objectMapper;

    private final RowMapper<LogRecord> recordMapper = this::mapRecord;

    public ClickHouseLogRepository(@Qualifier("clickHouseJdbcTemplate") JdbcTemplate jdbc,
                                   LogStatementBuilder statements,
                                   ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.statements = statements;
        this.objectMapper = objectMapper;
    }

    @Override
    public void insertBatch(List<LogRecord> records) {
        if (records == null || records.isEmpty()) return;
        jdbc.batchUpdate(INSERT_SQL, records, records.size(), this::bindRecord);
        log.debug("Inserted batch of {} log records", records.size());
    }

    @Override
    public LogQueryResult query(LogFilter filter) {
        SqlStatement select = statements.select(filter);
        if (log.isDebugEnabled()) {
            log.debug("Log search: {} args={}", select.sql(), select.args());
        }
        List<LogRecord> entries = jdbc.query(select.sql(), recordMapper, jdbcArgs(select));
        long total = count(filter);
        boolean hasMore = filter.offset() + entries.size() < total;
        return new LogQueryResult(entries, total, hasMore);
    }

    @Override
    public long count(LogFilter filter) {
        SqlStatement count = statements.count(filter);
        Long total = jdbc.queryForObject(count.sql(), Long.class, jdbcArgs(count));
        return total != null ? total : 0L;
    }

    @Override
    public long deleteBefore(OffsetDateTime before) {
        Timestamp cutoff = Timestamp.from(before.toInstant());
        Long matched = jdbc.queryForObject(
                "SELECT count() FROM " + LogStatementBuilder.TABLE + " WHERE timestamp < ?", Long.class, cutoff);
        long affected = matched != null ? matched : 0L;
        if (affected > 0) {
            jdbc.update("ALTER TABLE " + LogStatementBuilder.TABLE + " DELETE WHERE timestamp < ?", cutoff);
            log.info("Scheduled deletion of {} log records older than {}", affected, before);
        }
        return affected;
    }

    @Override
    public ErrorRateResult errorRates(AggregationFilter filter) {
        SqlStatement stmt = statements.errorRates(filter);
        ErrorRateResult result = jdbc.queryForObject(stmt.sql(),
                (rs, rowNum) -> ErrorRateResult.of(
                        rs.getLong("total"),
                        rs.getLong("errors"),
                        rs.getLong("warnings"),
                        rs.getLong("fatals")),
                jdbcArgs(stmt));
        return result != null ? result : ErrorRateResult.of(0, 0, 0, 0);
    }

    @Override
    public List<SourceCount> topSources(AggregationFilter filter, int limit) {
        SqlStatement stmt = statements.topSources(filter, limit);
        return jdbc.query(stmt.sql(),
                (rs, rowNum) -> new SourceCount(rs.getString("source"), rs.getLong("total"), rs.getLong("errors")),
                jdbcArgs(stmt));
    }

    @Override
    public List<VolumePoint> volume(AggregationFilter filter, VolumeInterval interval) {
        SqlStatement stmt = statements.volume(filter, interval);
        return jdbc.query(stmt.sql(),
                (rs, rowNum) -> new VolumePoint(toOffsetDateTime(rs.getTimestamp("ts")),
                        rs.getLong("total"), rs.getLong("errors")),
                jdbcArgs(stmt));
    }

    @Override
    public HttpStatsResult httpStats(AggregationFilter filter, int topUriLimit) {
        SqlStatement classes = statements.httpStatusClasses(filter);
        HttpStatsResult totals = jdbc.queryForObject(classes.sql(),
                (rs, rowNum) -> new HttpStatsResult(
                        rs.getLong("total_2xx"),
                        rs.getLong("total_3xx"),
                        rs.getLong("total_4xx"),
                        rs.getLong("total_5xx"),
                        List.of()),
                jdbcArgs(classes));

        SqlStatement uris = statements.topUris(filter, topUriLimit);
        List<UriCount> topUris = jdbc.query(uris.sql(),
                (rs, rowNum) -> new UriCount(rs.getString("uri"), rs.getLong("cnt")),
                jdbcArgs(uris));

        HttpStatsResult base = totals != null ? totals : new HttpStatsResult(0, 0, 0, 0, List.of());
        return base.withTopUris(topUris);
    }

    // --- Binding --------------------------------------------------------------------------------

    private void bindRecord(PreparedStatement ps, LogRecord record) throws SQLException {
        ps.setObject(1, toUuid(record.id()));
        OffsetDateTime timestamp = record.timestamp() != null ? record.timestamp() : OffsetDateTime.now(ZoneOffset.UTC);
        ps.setTimestamp(2, Timestamp.from(timestamp.toInstant()));
        ps.setString(3, nullToEmpty(record.level()));
        ps.setString(4, nullToEmpty(record.message()));
        ps.setString(5, nullToEmpty(record.source()));
        ps.setString(6, nullToEmpty(record.type()));
        ps.setString(7, nullToEmpty(record.raw()));
        ps.setString(8, nullToEmpty(record.agentId()));
        ps.setString(9, nullToEmpty(record.filePath()));
        ps.setLong(10, record.lineNumber());
        ps.setString(11, writeJson(record.fields()));
        ps.setString(12, writeJson(record.labels()));
        ps.setInt(13, record.httpStatus());
        ps.setString(14, nullToEmpty(record.httpMethod()));
        ps.setString(15, nullToEmpty(record.uri()));
    }

    static Object[] jdbcArgs(SqlStatement statement) {
        return Arrays.stream(statement.argsArray())
                .map(arg -> arg instanceof OffsetDateTime odt ? Timestamp.from(odt.toInstant()) : arg)
                .toArray();
    }

    // --- Mapping --------------------------------------------------------------------------------

    private LogRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
        return LogRecord.builder()
                .id(rs.getString("id"))
                .timestamp(toOffsetDateTime(rs.getTimestamp("timestamp")))
                .level(rs.getString("level"))
                .message(rs.getString("message"))
                .source(rs.getString("source"))
                .type(rs.getString("type"))
                .raw(rs.getString("raw"))
                .agentId(rs.getString("agent_id"))
                .filePath(rs.getString("file_path"))
                .lineNumber(rs.getLong("line_number"))
                .fields(readJson(rs.getString("fields"), FIELDS_TYPE))
                .labels(readJson(rs.getString("labels"), LABELS_TYPE))
                .httpStatus(rs.getInt("http_status"))
                .httpMethod(rs.getString("http_method"))
                .uri(rs.getString("uri"))
                .build();
    }

    private <T> T readJson(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) return null;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.debug("Unable to decode stored JSON column: {}", e.getOriginalMessage());
            return null;
        }
    }

    private String writeJson(Map<String, ?> value) {
        if (value == null || value.isEmpty()) return "{}";
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Unable to encode log record JSON column, storing empty object: {}", e.getOriginalMessage());
            return "{}";
        }
    }

    private static OffsetDateTime toOffsetDateTime(Timestamp ts) {
        return ts != null ? ts.toInstant().atOffset(ZoneOffset.UTC) : null;
    }

    private static UUID toUuid(String id) {
        if (id == null || id.isBlank()) {
            return UUID.randomUUID();
        }
        try {
            return UUID.fromString(id);
        } catch (IllegalArgumentException e) {
            return UUID.nameUUIDFromBytes(id.getBytes(StandardCharsets.UTF_8));
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
