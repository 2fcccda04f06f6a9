package io.logscope.engine.config;

import jakarta.annotation.PostConstruct;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Creates the logs table, its skip indexes and the dashboard materialized views. Every
 * statement is idempotent so it runs on each start.
 */
@Configuration
@ConditionalOnBean(name = "clickHouseJdbcTemplate")
public class ClickHouseInitializer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClickHouseInitializer.class);

    static final List<String> INDEXES = List.of(
            "ALTER TABLE logs ADD INDEX IF NOT EXISTS idx_message message TYPE tokenbf_v1(32768, 3, 0) GRANULARITY 4",
            "ALTER TABLE logs ADD INDEX IF NOT EXISTS idx_source source TYPE bloom_filter(0.01) GRANULARITY 4",
            "ALTER TABLE logs ADD INDEX IF NOT EXISTS idx_file_path file_path TYPE bloom_filter(0.01) GRANULARITY 4",
            "ALTER TABLE logs ADD INDEX IF NOT EXISTS idx_message_ngram message TYPE ngrambf_v1(3, 65536, 3, 0) GRANULARITY 4",
            "ALTER TABLE logs ADD INDEX IF NOT EXISTS idx_timestamp_minmax timestamp TYPE minmax GRANULARITY 3",
            "ALTER TABLE logs ADD INDEX IF NOT EXISTS idx_http_status http_status TYPE set(100) GRANULARITY 4"
    );

    static final List<String> MATERIALIZED_VIEWS = List.of(
            """
            CREATE MATERIALIZED VIEW IF NOT EXISTS logs_hourly_errors_mv
            ENGINE = SummingMergeTree()
            PARTITION BY toYYYYMM(hour)
            ORDER BY (agent_id, type, level, hour)
            AS SELECT agent_id, type, level, toStartOfHour(timestamp) AS hour, count() AS count
            FROM logs
            WHERE level IN ('error', 'fatal', 'warning')
            GROUP BY agent_id, type, level, hour
            """,
            """
            CREATE MATERIALIZED VIEW IF NOT EXISTS logs_daily_volume_mv
            ENGINE = SummingMergeTree()
            PARTITION BY toYYYYMM(day)
            ORDER BY (agent_id, type, day)
            AS SELECT agent_id, type, toDate(timestamp) AS day,
                      count() AS total_count,
                      countIf(level = 'error') AS error_count,
                      countIf(level = 'fatal') AS fatal_count,
                      countIf(level = 'warning') AS warning_count
            FROM logs
            GROUP BY agent_id, type, day
            """,
            """
            CREATE MATERIALIZED VIEW IF NOT EXISTS logs_http_stats_mv
            ENGINE = SummingMergeTree()
            PARTITION BY toYYYYMM(hour)
            ORDER BY (agent_id, hour, http_status)
            AS SELECT agent_id, toStartOfHour(timestamp) AS hour, http_status, count() AS count
            FROM logs
            WHERE http_status > 0
            GROUP BY agent_id, hour, http_status
            """
    );

    private final JdbcTemplate ch;
    private final String db;
    private final int retentionDays;

    public ClickHouseInitializer(@Qualifier("clickHouseJdbcTemplate") JdbcTemplate ch,
                                 @Value("${app.clickhouse.database:logscope}") String db,
                                 @Value("${app.clickhouse.retention-days:30}") int retentionDays) {
        this.ch = ch;
        this.db = db;
        this.retentionDays = retentionDays;
    }

    @PostConstruct
    public void init() {
        try {
            ch.execute("CREATE DATABASE IF NOT EXISTS " + db);
            ch.execute(tableDdl(retentionDays));
            LOGGER.info("ClickHouse initialized: database='{}', table='logs', retention={} days", db, retentionDays);
        } catch (Exception e) {
            // ClickHouse unreachable: do not fail startup
            LOGGER.warn("ClickHouse init skipped: {}", e.getMessage());
            return;
        }

        for (String index : INDEXES) {
            try {
                ch.execute(index);
            } catch (Exception e) {
                LOGGER.warn("ClickHouse index not created: {}", e.getMessage());
            }
        }
        for (String view : MATERIALIZED_VIEWS) {
            try {
                ch.execute(view);
            } catch (Exception e) {
                LOGGER.warn("ClickHouse materialized view not created: {}", e.getMessage());
            }
        }
    }

    static String tableDdl(int retentionDays) {
        if (retentionDays <= 0) {
            throw new IllegalStateException("app.clickhouse.retention-days must be positive");
        }
        return """
                CREATE TABLE IF NOT EXISTS logs (
                  id UUID DEFAULT generateUUIDv4(),
                  timestamp DateTime64(3, 'UTC'),
                  level LowCardinality(String),
                  message String,
                  source String,
                  type LowCardinality(String),
                  raw String,
                  agent_id String,
                  file_path String,
                  line_number Int64,
                  fields String,
                  labels String,
                  http_status UInt16 DEFAULT 0,
                  http_method LowCardinality(String) DEFAULT '',
                  uri String DEFAULT '',
                  _date Date DEFAULT toDate(timestamp)
                ) ENGINE = MergeTree
                PARTITION BY toYYYYMM(_date)
                ORDER BY (agent_id, type, level, timestamp, id)
                TTL _date + INTERVAL %d DAY DELETE
                SETTINGS index_granularity = 8192
                """.formatted(retentionDays);
    }
}
