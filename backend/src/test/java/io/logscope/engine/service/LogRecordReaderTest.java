package io.logscope.engine.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.logscope.engine.model.LogRecord;
import java.time.OffsetDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LogRecordReaderTest {

    private LogRecordReader reader;

    @BeforeEach
    void setUp() {
        reader = new LogRecordReader(new ObjectMapper());
    }

    @Test
    void mapsStructuredJsonLine() {
        String json = """
                {"timestamp":"2024-05-10T12:00:00Z","level":"WARN","message":"slow upstream",
                 "source":"nginx","type":"access","agent_id":"edge-1","file_path":"/var/log/nginx/access.log",
                 "line_number":17,"fields":{"status":502,"method":"get","request_uri":"/api/orders"},
                 "labels":{"env":"prod"}}
                """;

        LogRecord record = reader.read(json);

        assertThat(record.timestamp()).isEqualTo(OffsetDateTime.parse("2024-05-10T12:00:00Z"));
        assertThat(record.level()).isEqualTo("WARN");
        assertThat(record.message()).isEqualTo("slow upstream");
        assertThat(record.agentId()).isEqualTo("edge-1");
        assertThat(record.lineNumber()).isEqualTo(17);
        assertThat(record.fields()).containsEntry("status", 502).containsEntry("method", "get");
        assertThat(record.labels()).containsEntry("env", "prod");
        assertThat(record.raw()).isEqualTo(json);
    }

    @Test
    void unknownTopLevelKeysBecomeFields() {
        LogRecord record = reader.read("{\"msg\":\"hello\",\"ts\":1715342400,\"user\":\"bob\",\"latency_ms\":12}");

        assertThat(record.message()).isEqualTo("hello");
        assertThat(record.timestamp()).isEqualTo(OffsetDateTime.parse("2024-05-10T12:00:00Z"));
        assertThat(record.fields()).containsEntry("user", "bob").containsEntry("latency_ms", 12)
                .doesNotContainKeys("msg", "ts");
    }

    @Test
    void keepsPlainTextAsMessage() {
        String line = "2024-05-13T09:15:30Z [error] upstream connect failed";

        LogRecord record = reader.read(line);

        assertThat(record.timestamp()).isEqualTo(OffsetDateTime.parse("2024-05-13T09:15:30Z"));
        assertThat(record.level()).isEqualTo("error");
        assertThat(record.message()).isEqualTo(line);
        assertThat(record.fields()).isEmpty();
    }

    @Test
    void rejectsBlankLines() {
        assertThatThrownBy(() -> reader.read("   ")).isInstanceOf(IllegalArgumentException.class);
    }
}
