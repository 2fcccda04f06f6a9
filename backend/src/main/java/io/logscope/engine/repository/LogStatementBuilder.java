package io.logscope.engine.repository;

import io.logscope.engine.model.AggregationFilter;
import io.logscope.engine.model.LogFilter;
import io.logscope.engine.model.VolumeInterval;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;
import org.springframework.util.StringUtils;

/**
 * Builds the parameterised ClickHouse statements run against the {@code logs} table.
 * <p>
 * Time bounds go to {@code PREWHERE} so granules outside the range are skipped before other
 * columns are read; their arguments always come first.
 */
public class LogStatementBuilder {

    public static final String TABLE = "logs";

    static final String SELECT_COLUMNS = "id, timestamp, level, message, source, type, raw, agent_id, file_path, "
            + "line_number, fields, labels, http_status, http_method, uri";

    private static final String ERROR_LEVELS = "level IN ('error', 'fatal')";

    // --- Search -------------------------------------------------------------------------------

    public SqlStatement select(LogFilter filter) {
        Clauses clauses = searchClauses(filter);
        StringBuilder sql = new StringBuilder("SELECT ").append(SELECT_COLUMNS).append(" FROM ").append(TABLE);
        clauses.appendTo(sql);
        sql.append(" ORDER BY ").append(filter.sortBy().column()).append(filter.ascending() ? " ASC" : " DESC");
        sql.append(" LIMIT ").append(filter.limit());
        if (filter.offset() > 0) {
            sql.append(" OFFSET ").append(filter.offset());
        }
        return new SqlStatement(sql.toString(), clauses.args());
    }

    public SqlStatement count(LogFilter filter) {
        Clauses clauses = searchClauses(filter);
        StringBuilder sql = new StringBuilder("SELECT count() FROM ").append(TABLE);
        clauses.appendTo(sql);
        return new SqlStatement(sql.toString(), clauses.args());
    }

    private Clauses searchClauses(LogFilter filter) {
        Clauses clauses = new Clauses();
        if (filter.from() != null) {
            clauses.prewhere("timestamp >= ?", filter.from());
        }
        if (filter.to() != null) {
            clauses.prewhere("timestamp <= ?", filter.to());
        }

        if (filter.hasExpression()) {
            clauses.where(filter.expression().sql(), filter.expression().args().toArray());
            return clauses;
        }

        if (StringUtils.hasText(filter.agentId())) {
            clauses.where("agent_id = ?", filter.agentId());
        }
        if (StringUtils.hasText(filter.level())) {
            clauses.where("level = ?", filter.level());
        } else if (!filter.levels().isEmpty()) {
            clauses.where("level IN " + placeholders(filter.levels().size()), filter.levels().toArray());
        }
        if (StringUtils.hasText(filter.type())) {
            clauses.where("type = ?", filter.type());
        } else if (!filter.types().isEmpty()) {
            clauses.where("type IN " + placeholders(filter.types().size()), filter.types().toArray());
        }
        if (StringUtils.hasText(filter.source())) {
            clauses.where("source = ?", filter.source());
        }
        if (StringUtils.hasText(filter.filePath())) {
            clauses.where("file_path = ?", filter.filePath());
        }
        if (StringUtils.hasText(filter.search())) {
            appendSearch(clauses, filter);
        }
        return clauses;
    }

    private void appendSearch(Clauses clauses, LogFilter filter) {
        String text = filter.search().trim();
        switch (filter.searchMode()) {
            case SUBSTRING:
                clauses.where("position(message, ?) > 0", text);
                break;
            case PHRASE:
                for (String word : text.split("\\s+")) {
                    clauses.where("hasToken(message, ?)", word);
                }
                break;
            default:
                clauses.where("hasToken(message, ?)", text);
                break;
        }
    }

    // --- Aggregations -------------------------------------------------------------------------

    public SqlStatement errorRates(AggregationFilter filter) {
        Clauses clauses = aggregationClauses(filter);
        StringBuilder sql = new StringBuilder("SELECT count() AS total, countIf(level = 'error') AS errors, ")
                .append("countIf(level = 'warning') AS warnings, countIf(level = 'fatal') AS fatals FROM ")
                .append(TABLE);
        clauses.appendTo(sql);
        return new SqlStatement(sql.toString(), clauses.args());
    }

    public SqlStatement topSources(AggregationFilter filter, int limit) {
        Clauses clauses = aggregationClauses(filter);
        StringBuilder sql = new StringBuilder("SELECT source, count() AS total, countIf(")
                .append(ERROR_LEVELS).append(") AS errors FROM ").append(TABLE);
        clauses.appendTo(sql);
        sql.append(" GROUP BY source ORDER BY total DESC LIMIT ").append(limit);
        return new SqlStatement(sql.toString(), clauses.args());
    }

    public SqlStatement volume(AggregationFilter filter, VolumeInterval interval) {
        Clauses clauses = aggregationClauses(filter);
        StringBuilder sql = new StringBuilder("SELECT ").append(interval.function())
                .append("(timestamp) AS ts, count() AS total, countIf(").append(ERROR_LEVELS)
                .append(") AS errors FROM ").append(TABLE);
        clauses.appendTo(sql);
        sql.append(" GROUP BY ts ORDER BY ts ASC");
        return new SqlStatement(sql.toString(), clauses.args());
    }

    public SqlStatement httpStatusClasses(AggregationFilter filter) {
        Clauses clauses = aggregationClauses(filter);
        clauses.where("http_status > 0");
        StringBuilder sql = new StringBuilder("SELECT ")
                .append("countIf(http_status >= 200 AND http_status < 300) AS total_2xx, ")
                .append("countIf(http_status >= 300 AND http_status < 400) AS total_3xx, ")
                .append("countIf(http_status >= 400 AND http_status < 500) AS total_4xx, ")
                .append("countIf(http_status >= 500 AND http_status < 600) AS total_5xx FROM ")
                .append(TABLE);
        clauses.appendTo(sql);
        return new SqlStatement(sql.toString(), clauses.args());
    }

    public SqlStatement topUris(AggregationFilter filter, int limit) {
        Clauses clauses = aggregationClauses(filter);
        clauses.where("http_status > 0");
        clauses.where("uri != ''");
        StringBuilder sql = new StringBuilder("SELECT uri, count() AS cnt FROM ").append(TABLE);
        clauses.appendTo(sql);
        sql.append(" GROUP BY uri ORDER BY cnt DESC LIMIT ").append(limit);
        return new SqlStatement(sql.toString(), clauses.args());
    }

    private Clauses aggregationClauses(AggregationFilter filter) {
        Clauses clauses = new Clauses();
        if (filter.from() != null) {
            clauses.where("timestamp >= ?", filter.from());
        }
        if (filter.to() != null) {
            clauses.where("timestamp <= ?", filter.to());
        }
        if (StringUtils.hasText(filter.agentId())) {
            clauses.where("agent_id = ?", filter.agentId());
        }
        if (StringUtils.hasText(filter.type())) {
            clauses.where("type = ?", filter.type());
        }
        return clauses;
    }

    private static String placeholders(int count) {
        StringJoiner joiner = new StringJoiner(", ", "(", ")");
        for (int i = 0; i < count; i++) {
            joiner.add("?");
        }
        return joiner.toString();
    }

    private static final class Clauses {
        private final List<String> prewhere = new ArrayList<>();
        private final List<Object> prewhereArgs = new ArrayList<>();
        private final List<String> where = new ArrayList<>();
        private final List<Object> whereArgs = new ArrayList<>();

        void prewhere(String condition, Object... args) {
            prewhere.add(condition);
            prewhereArgs.addAll(Arrays.asList(args));
        }

        void where(String condition, Object... args) {
            where.add(condition);
            whereArgs.addAll(Arrays.asList(args));
        }

        void appendTo(StringBuilder sql) {
            if (!prewhere.isEmpty()) {
                sql.append(" PREWHERE ").append(String.join(" AND ", prewhere));
            }
            if (!where.isEmpty()) {
                sql.append(" WHERE ").append(String.join(" AND ", where));
            }
        }

        List<Object> args() {
            List<Object> args = new ArrayList<>(prewhereArgs);
            args.addAll(whereArgs);
            return args;
        }
    }
}
